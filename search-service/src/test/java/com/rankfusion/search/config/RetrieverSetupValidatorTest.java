package com.rankfusion.search.config;

import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.error.RetrievalFailureKind;
import com.rankfusion.search.model.RetrievalSource;
import com.rankfusion.search.service.TextRetriever;
import com.rankfusion.search.service.VectorRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RetrieverSetupValidatorTest {

    private VectorRetriever vectorRetriever;
    private TextRetriever textRetriever;

    @BeforeEach
    void setUp() {
        vectorRetriever = mock(VectorRetriever.class);
        textRetriever = mock(TextRetriever.class);
        when(vectorRetriever.source()).thenReturn(RetrievalSource.VECTOR);
        when(textRetriever.source()).thenReturn(RetrievalSource.TEXT);
    }

    @Test
    void testDisabledValidationTouchesNothing() {
        new RetrieverSetupValidator(vectorRetriever, textRetriever, false, true).run(new DefaultApplicationArguments());

        verifyNoInteractions(vectorRetriever, textRetriever);
    }

    @Test
    void testChecksBothRetrievers() {
        new RetrieverSetupValidator(vectorRetriever, textRetriever, true, true).run(new DefaultApplicationArguments());

        verify(vectorRetriever).verifySetup();
        verify(textRetriever).verifySetup();
    }

    @Test
    void testFailFastAbortsStartup() {
        RetrievalException missingIndex = new RetrievalException(
                RetrievalSource.VECTOR, RetrievalFailureKind.UNAVAILABLE, "index vectorIndex not found");
        doThrow(missingIndex).when(vectorRetriever).verifySetup();

        RetrieverSetupValidator validator = new RetrieverSetupValidator(vectorRetriever, textRetriever, true, true);

        assertThatThrownBy(() -> validator.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .satisfies(ex -> assertThat(ex.getSuppressed()).containsExactly(missingIndex));
        verify(textRetriever).verifySetup();
    }

    @Test
    void testLenientModeOnlyLogs() {
        doThrow(new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.UNAVAILABLE, "ping failed"))
                .when(textRetriever).verifySetup();

        RetrieverSetupValidator validator = new RetrieverSetupValidator(vectorRetriever, textRetriever, true, false);

        assertThatCode(() -> validator.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }
}
