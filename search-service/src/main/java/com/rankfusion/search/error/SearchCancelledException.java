package com.rankfusion.search.error;

import java.util.concurrent.CancellationException;

public class SearchCancelledException extends CancellationException {

    public SearchCancelledException(String message) {
        super(message);
    }
}
