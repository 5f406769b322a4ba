package com.keystone.auth.dto;

final class PasswordRules {

    static final String PATTERN = "^(?=.*[A-Za-z])(?=.*\\d).+$";
    static final String MESSAGE = "Password must contain at least one letter and one number";

    private PasswordRules() {
    }
}
