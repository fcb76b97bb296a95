package com.coparent.service;

import com.coparent.config.CoparentProperties;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Best-effort outbound mail. Nothing is sent unless {@code coparent.mail.enabled}
 * is set and a {@link JavaMailSender} is configured.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final CoparentProperties properties;

    @Async
    public void sendFamilyInvite(String to, String inviterName, String familyName, String shareCode) {
        String subject = inviterName + " invited you to co-parent on Coparent";
        String body = "<p>" + escape(inviterName) + " invited you to join the family <b>"
                + escape(familyName == null ? "their family" : familyName) + "</b>.</p>"
                + "<p>Sign in with this e-mail address at <a href=\"" + properties.getMail().getAppUrl() + "\">"
                + properties.getMail().getAppUrl() + "</a> to accept, or join with the code <b>"
                + shareCode + "</b>.</p>";
        send(to, subject, body);
    }

    private void send(String to, String subject, String html) {
        if (!properties.getMail().isEnabled()) {
            log.debug("Mail disabled, not sending '{}' to {}", subject, to);
            return;
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.warn("Mail enabled but no JavaMailSender is configured, dropping '{}'", subject);
            return;
        }

        try {
            MimeMessage mail = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mail, true, "UTF-8");
            helper.setTo(to);
            helper.setFrom(properties.getMail().getFrom());
            helper.setSubject(subject);
            helper.setText(html.replaceAll("<[^>]+>", " ").replaceAll("\\s+", " ").trim(), html);
            mailSender.send(mail);
            log.info("Email '{}' sent to {}", subject, to);
        } catch (Exception e) {
            log.error("Failed to send email '{}' to {}", subject, to, e);
        }
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
