package com.keystone.auth.domain;

public enum TokenType {
    ACCESS,
    REFRESH,
    RESET_PASSWORD,
    VERIFY_EMAIL
}
