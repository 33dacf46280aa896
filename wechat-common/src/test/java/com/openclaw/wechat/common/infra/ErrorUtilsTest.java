package com.openclaw.wechat.common.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_usesMessageOrClassName() {
        assertEquals("boom", ErrorUtils.formatErrorMessage(new IllegalStateException("boom")));
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatErrorMessage_unwrapsCompletionException() {
        Throwable wrapped = new CompletionException(new IllegalArgumentException("inner"));
        assertEquals("inner", ErrorUtils.formatErrorMessage(wrapped));
    }
}
