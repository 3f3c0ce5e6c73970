package com.livedesk.relay.common.email;

import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Service
@ConditionalOnProperty(name = "app.notify.email.enabled", havingValue = "true")
public class EmailDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(EmailDeliveryService.class);

    private final JavaMailSender mailSender;
    private final String from;

    public EmailDeliveryService(
            JavaMailSender mailSender,
            @Value("${app.email.from:}") String from,
            @Value("${spring.mail.username:}") String username
    ) {
        this.mailSender = mailSender;
        var candidate = (from == null || from.isBlank()) ? username : from;
        this.from = (candidate == null || candidate.isBlank()) ? null : candidate.trim();
    }

    public void send(String to, String subject, String body) {
        if (to == null || to.isBlank()) throw new IllegalArgumentException("email_to_required");
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("email_subject_required");
        if (body == null) body = "";
        if (from == null) {
            throw new IllegalStateException("email_from_required");
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(body, false);
            mailSender.send(message);
            log.info("email_out (smtp) to={} subject={}", to, subject);
        } catch (Exception e) {
            log.error("email_send_failed to={} subject={}", to, subject, e);
            throw new IllegalStateException("email_send_failed", e);
        }
    }
}
