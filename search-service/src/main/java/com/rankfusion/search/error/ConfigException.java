package com.rankfusion.search.error;

public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }
}
