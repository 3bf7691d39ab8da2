package com.abba.agenda.infrastructure.notification;

import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.infrastructure.config.NotificationProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends HTML notification mails with a plain-text alternative.
 */
@Component
@RequiredArgsConstructor
public class MailNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(MailNotificationSender.class);

    private final JavaMailSender mailSender;
    private final NotificationProperties notificationProperties;

    public void send(String toEmail, String subject, String recipientName, Map<String, String> details) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setTo(toEmail);
            helper.setSubject(subject);
            helper.setFrom(notificationProperties.getMailFrom());
            helper.setText(plainText(subject, recipientName, details), html(subject, recipientName, details));

            log.debug("Sending mail subject='{}' to='{}'", subject, toEmail);
            mailSender.send(message);
            log.info("Mail sent subject='{}' to='{}'", subject, toEmail);
        } catch (MessagingException | MailParseException | MailAuthenticationException e) {
            throw new CollaboratorException(FailureKind.BUSINESS_REJECTION, "Could not build mail to " + toEmail, e);
        } catch (MailException e) {
            throw new CollaboratorException(FailureKind.NETWORK, "Could not send mail to " + toEmail, e);
        }
    }

    static String html(String heading, String recipientName, Map<String, String> details) {
        StringBuilder rows = new StringBuilder();
        details.forEach((title, value) -> rows.append(row(title, value)));
        return "<!doctype html><html><head><meta charset='utf-8'/>"
                + "<title>" + escapeHtml(heading) + "</title></head><body>"
                + "<div style='font-family:Arial,Helvetica,sans-serif;max-width:600px;margin:0 auto;padding:20px;'>"
                + "<h2>" + escapeHtml(heading) + "</h2>"
                + "<p>Hi " + escapeHtml(recipientName) + ",</p>"
                + "<table style='width:100%;border-collapse:collapse'>" + rows + "</table>"
                + "</div></body></html>";
    }

    static String plainText(String heading, String recipientName, Map<String, String> details) {
        StringBuilder sb = new StringBuilder();
        sb.append(heading).append("\n\n");
        sb.append("Hi ").append(recipientName).append(",\n");
        details.forEach((title, value) -> sb.append(title).append(": ").append(value == null ? "-" : value).append("\n"));
        return sb.toString();
    }

    private static String row(String title, String value) {
        return "<tr><td style='padding:6px;border:1px solid #eee'><strong>" + escapeHtml(title) + "</strong></td>"
                + "<td style='padding:6px;border:1px solid #eee'>" + escapeHtml(value == null ? "-" : value) + "</td></tr>";
    }

    static String escapeHtml(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
