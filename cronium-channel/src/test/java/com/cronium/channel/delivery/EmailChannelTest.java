package com.cronium.channel.delivery;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.ChannelType;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.ToolCredential;
import com.cronium.common.config.CroniumConfig;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailChannelTest {

    /** Sender that keeps messages instead of talking SMTP. */
    static class CapturingSender extends JavaMailSenderImpl {
        final List<MimeMessage> sent = new ArrayList<>();
        CroniumConfig.SmtpConfig builtFor;
        boolean fail;

        @Override
        protected void doSend(MimeMessage[] mimeMessages, Object[] originalMessages) {
            if (fail)
                throw new MailSendException("Connection refused");
            sent.addAll(List.of(mimeMessages));
        }
    }

    private static CroniumConfig.SmtpConfig smtp() {
        CroniumConfig.SmtpConfig smtp = new CroniumConfig.SmtpConfig();
        smtp.setHost("smtp.example.com");
        smtp.setUser("bot");
        smtp.setPassword("secret");
        smtp.setFromEmail("bot@example.com");
        smtp.setFromName("Cronium");
        return smtp;
    }

    private final CapturingSender sender = new CapturingSender();
    private final EmailChannel channel = new EmailChannel(cfg -> {
        sender.builtFor = cfg;
        return sender;
    });

    @Test
    void sendsHtmlMessageToEveryRecipient() throws Exception {
        DeliveryResult result = channel.deliver(
                ToolCredential.builder().type(ChannelType.EMAIL).smtp(smtp()).build(),
                ChannelMessage.builder()
                        .recipients("ops@example.com, dev@example.com")
                        .subject("Event Failure: backup")
                        .body("<p>disk full</p>")
                        .build());

        assertTrue(result.success(), result.error());
        assertEquals(1, sender.sent.size());
        MimeMessage mime = sender.sent.get(0);
        mime.saveChanges();
        Address[] to = mime.getRecipients(Message.RecipientType.TO);
        assertEquals(2, to.length);
        assertEquals("dev@example.com", ((InternetAddress) to[1]).getAddress());
        assertEquals("Event Failure: backup", mime.getSubject());
        InternetAddress from = (InternetAddress) mime.getFrom()[0];
        assertEquals("bot@example.com", from.getAddress());
        assertEquals("Cronium", from.getPersonal());
        assertTrue(mime.getContentType().startsWith("text/html"));
        assertEquals("smtp.example.com", sender.builtFor.getHost());
    }

    @Test
    void missingSmtpSettings_isFailedResult() {
        CroniumConfig.SmtpConfig incomplete = smtp();
        incomplete.setPassword(null);

        DeliveryResult result = channel.deliver(
                ToolCredential.builder().type(ChannelType.EMAIL).smtp(incomplete).build(),
                ChannelMessage.builder().recipients("a@example.com").body("x").build());

        assertEquals("Missing required SMTP settings", result.error());
        assertTrue(sender.sent.isEmpty());
    }

    @Test
    void noRecipients_isFailedResult() {
        DeliveryResult result = channel.deliver(
                ToolCredential.builder().type(ChannelType.EMAIL).smtp(smtp()).build(),
                ChannelMessage.builder().recipients(" , ").body("x").build());

        assertEquals("No email recipients specified", result.error());
    }

    @Test
    void transportFailure_isFailedResult() {
        sender.fail = true;

        DeliveryResult result = channel.deliver(
                ToolCredential.builder().type(ChannelType.EMAIL).smtp(smtp()).build(),
                ChannelMessage.builder().recipients("a@example.com").body("x").build());

        assertFalse(result.success());
        assertTrue(result.error().startsWith("Failed to send email"));
    }

    @Test
    void splitRecipients_acceptsCommasAndSemicolons() {
        assertArrayEquals(new String[] { "a@x.io", "b@x.io", "c@x.io" },
                EmailChannel.splitRecipients("a@x.io; b@x.io,c@x.io,"));
    }

    @Test
    void createSender_usesImplicitTlsOnPort465() {
        CroniumConfig.SmtpConfig secure = smtp();
        secure.setPort(465);

        JavaMailSenderImpl built = (JavaMailSenderImpl) EmailChannel.createSender(secure);

        assertEquals("true", built.getJavaMailProperties().getProperty("mail.smtp.ssl.enable"));
        assertNull(built.getJavaMailProperties().getProperty("mail.smtp.starttls.enable"));
        assertEquals(465, built.getPort());
    }
}
