package com.keystone.auth.notification;

import com.keystone.auth.config.AuthProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Sends HTML email through the configured SMTP transport.
 *
 * Transport failures are retried with exponential backoff; the last failure
 * is rethrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailDeliveryService {

    private final JavaMailSender mailSender;
    private final AuthProperties properties;

    @Retryable(retryFor = MailException.class, maxAttempts = 3, backoff = @Backoff(delay = 1000, multiplier = 2))
    public void send(EmailMessage message) {
        MimeMessage mimeMessage = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getMail().getFrom());
            helper.setTo(message.to());
            helper.setSubject(message.subject());
            helper.setText(message.html(), true);
        } catch (MessagingException e) {
            throw new MailPreparationException("Could not prepare email '" + message.subject() + "'", e);
        }

        mailSender.send(mimeMessage);
        log.debug("Email '{}' sent to {}", message.subject(), message.to());
    }
}
