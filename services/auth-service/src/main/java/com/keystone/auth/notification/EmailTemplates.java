package com.keystone.auth.notification;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * HTML bodies of the account emails.
 */
@Component
@RequiredArgsConstructor
public class EmailTemplates {

    private static final DateTimeFormatter UTC_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final AuthProperties properties;

    public EmailMessage registration(User user, String verifyEmailToken) {
        return message(user, "Welcome to " + appName(),
                "Welcome aboard",
                paragraph("Your account for <strong>" + escape(user.getEmail()) + "</strong> has been created.")
                        + paragraph("Please confirm your email address to finish setting it up.")
                        + button(verifyEmailLink(verifyEmailToken), "Verify email"));
    }

    public EmailMessage loginSucceeded(User user) {
        return message(user, "New sign-in to your " + appName() + " account",
                "New sign-in detected",
                paragraph("Your account <strong>" + escape(user.getEmail()) + "</strong> was just used to sign in.")
                        + paragraph("If this was not you, reset your password right away and contact support."));
    }

    public EmailMessage accountLocked(User user, Instant lockedUntil) {
        return message(user, "Your " + appName() + " account has been locked",
                "Account locked",
                paragraph("We locked <strong>" + escape(user.getEmail())
                        + "</strong> after too many failed sign-in attempts.")
                        + paragraph("You can sign in again after " + UTC_TIME.format(lockedUntil) + ".")
                        + paragraph("If these attempts were not yours, change your password once the lock expires."));
    }

    public EmailMessage maxSessionsReached(User user, int maxSessions) {
        return message(user, "Active session limit reached",
                "Too many active sessions",
                paragraph("A sign-in to <strong>" + escape(user.getEmail()) + "</strong> was refused because "
                        + maxSessions + " sessions are already active.")
                        + paragraph("Sign out from a device you no longer use, then try again.")
                        + paragraph("If you do not recognize these sessions, reset your password."));
    }

    public EmailMessage passwordResetRequested(User user, String resetToken) {
        return message(user, "Reset your password",
                "Password reset",
                paragraph("We received a request to reset the password of <strong>"
                        + escape(user.getEmail()) + "</strong>.")
                        + button(resetPasswordLink(resetToken), "Reset password")
                        + paragraph("The link expires in "
                        + properties.getJwt().getResetPasswordExpirationMinutes() + " minutes.")
                        + paragraph("If you did not ask for this, you can ignore this email."));
    }

    public EmailMessage passwordResetSucceeded(User user) {
        return message(user, "Your password was changed",
                "Password changed",
                paragraph("The password of <strong>" + escape(user.getEmail()) + "</strong> has been changed.")
                        + paragraph("If you did not make this change, contact support immediately."));
    }

    public EmailMessage verificationRequested(User user, String verifyEmailToken) {
        return message(user, "Verify your email address",
                "Email verification",
                paragraph("Confirm that <strong>" + escape(user.getEmail()) + "</strong> belongs to you.")
                        + button(verifyEmailLink(verifyEmailToken), "Verify email")
                        + paragraph("The link expires in "
                        + properties.getJwt().getVerifyEmailExpirationMinutes() + " minutes."));
    }

    public EmailMessage emailVerified(User user) {
        return message(user, "Email address verified",
                "Email verified",
                paragraph("<strong>" + escape(user.getEmail()) + "</strong> is now verified. Your account is fully active."));
    }

    String resetPasswordLink(String token) {
        return UriComponentsBuilder.fromUriString(properties.getFrontend().getResetPasswordUrl())
                .queryParam("token", token)
                .toUriString();
    }

    String verifyEmailLink(String token) {
        return UriComponentsBuilder.fromUriString(properties.getFrontend().getVerifyEmailUrl())
                .queryParam("token", token)
                .toUriString();
    }

    private EmailMessage message(User user, String subject, String heading, String body) {
        String html = "<!DOCTYPE html><html><body style=\"font-family:Arial,sans-serif;color:#333;\">"
                + "<div style=\"max-width:600px;margin:0 auto;padding:24px;\">"
                + "<h2 style=\"color:#1a3d6d;\">" + escape(heading) + "</h2>"
                + paragraph("Dear " + escape(user.getName()) + ",")
                + body
                + paragraph("The " + escape(appName()) + " team")
                + "</div></body></html>";
        return new EmailMessage(user.getEmail(), subject, html);
    }

    private String appName() {
        return properties.getMail().getAppName();
    }

    private static String paragraph(String content) {
        return "<p>" + content + "</p>";
    }

    private static String button(String href, String label) {
        return "<p><a href=\"" + escape(href) + "\" style=\"display:inline-block;padding:10px 20px;"
                + "background:#1a3d6d;color:#fff;text-decoration:none;border-radius:4px;\">"
                + escape(label) + "</a></p>";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
