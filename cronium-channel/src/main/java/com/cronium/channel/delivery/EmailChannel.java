package com.cronium.channel.delivery;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.ToolCredential;
import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.ErrorUtils;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import java.util.function.Function;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. A sender is built
 * per send from the credential's SMTP settings.
 */
@Slf4j
public final class EmailChannel implements NotificationChannel {

    private final Function<CroniumConfig.SmtpConfig, JavaMailSender> senderFactory;

    public EmailChannel() {
        this(EmailChannel::createSender);
    }

    public EmailChannel(Function<CroniumConfig.SmtpConfig, JavaMailSender> senderFactory) {
        this.senderFactory = senderFactory;
    }

    @Override
    public DeliveryResult deliver(ToolCredential credential, ChannelMessage message) {
        CroniumConfig.SmtpConfig smtp = credential.getSmtp();
        if (smtp == null || isBlank(smtp.getHost()) || isBlank(smtp.getUser()) || isBlank(smtp.getPassword())) {
            return DeliveryResult.failed("Missing required SMTP settings");
        }
        String[] recipients = splitRecipients(message.getRecipients());
        if (recipients.length == 0) {
            return DeliveryResult.failed("No email recipients specified");
        }

        JavaMailSender sender = senderFactory.apply(smtp);
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            String fromEmail = isBlank(smtp.getFromEmail()) ? smtp.getUser() : smtp.getFromEmail();
            if (isBlank(smtp.getFromName())) {
                helper.setFrom(fromEmail);
            } else {
                helper.setFrom(fromEmail, smtp.getFromName());
            }
            helper.setTo(recipients);
            helper.setSubject(message.getSubject() != null ? message.getSubject() : "");
            helper.setText(message.getBody() != null ? message.getBody() : "", message.isHtml());
            sender.send(mime);
            log.debug("Email sent to {} recipient(s) via {}", recipients.length, smtp.getHost());
            return DeliveryResult.ok();
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            return DeliveryResult.failed("Failed to send email: " + ErrorUtils.formatErrorMessage(e));
        }
    }

    static String[] splitRecipients(String recipients) {
        if (recipients == null)
            return new String[0];
        return Arrays.stream(recipients.split("[,;]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    /**
     * Build a sender for one SMTP configuration. Port 465 uses implicit TLS,
     * other ports STARTTLS when enabled.
     */
    public static JavaMailSender createSender(CroniumConfig.SmtpConfig smtp) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(smtp.getHost());
        sender.setPort(smtp.getPort());
        sender.setUsername(smtp.getUser());
        sender.setPassword(smtp.getPassword());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "30000");
        if (smtp.getPort() == 465) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (smtp.isStartTls()) {
            props.put("mail.smtp.starttls.enable", "true");
        }
        return sender;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
