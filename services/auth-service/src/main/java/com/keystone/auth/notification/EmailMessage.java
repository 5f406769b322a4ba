package com.keystone.auth.notification;

public record EmailMessage(String to, String subject, String html) {
}
