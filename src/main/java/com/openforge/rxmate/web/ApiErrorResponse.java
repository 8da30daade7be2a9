package com.openforge.rxmate.web;

/** Error body of every non-2xx JSON response: {"status":400,"message":"..."}. */
public record ApiErrorResponse(int status, String message) {}
