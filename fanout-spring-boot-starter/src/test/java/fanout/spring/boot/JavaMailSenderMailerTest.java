package fanout.spring.boot;

import fanout.spi.MailerException;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class JavaMailSenderMailerTest {

  @Test
  void sendsMessageWithSenderAndSubject() throws Exception {
    CapturingSender sender = new CapturingSender("<abc@smtp.test>");
    JavaMailSenderMailer mailer = new JavaMailSenderMailer(sender, "news@example.com", "Weekly");

    String messageId = mailer.send("reader@example.com", "Issue 1", "hello");

    assertEquals("<abc@smtp.test>", messageId);
    assertEquals(1, sender.sent.size());
    MimeMessage message = sender.sent.get(0);
    assertEquals("Issue 1", message.getSubject());
    InternetAddress from = (InternetAddress) message.getFrom()[0];
    assertEquals("news@example.com", from.getAddress());
    assertEquals("Weekly", from.getPersonal());
    assertEquals("reader@example.com", ((InternetAddress) message.getAllRecipients()[0]).getAddress());
  }

  @Test
  void generatesMessageIdWhenTransportAssignsNone() throws Exception {
    JavaMailSenderMailer mailer = new JavaMailSenderMailer(new CapturingSender(null), "news@example.com", null);

    String messageId = mailer.send("reader@example.com", "Issue 1", "hello");

    assertTrue(messageId.startsWith("<"));
    assertTrue(messageId.endsWith("@fanout>"));
  }

  @Test
  void transportFailureBecomesMailerException() {
    JavaMailSenderImpl failing = new JavaMailSenderImpl() {
      @Override
      protected void doSend(MimeMessage[] mimeMessages, Object[] originalMessages) throws MailException {
        throw new MailSendException("connection refused");
      }
    };
    JavaMailSenderMailer mailer = new JavaMailSenderMailer(failing, "news@example.com", null);

    MailerException e = assertThrows(MailerException.class,
        () -> mailer.send("reader@example.com", "Issue 1", "hello"));
    assertTrue(e.getMessage().contains("connection refused"));
    assertInstanceOf(MailSendException.class, e.getCause());
  }

  @Test
  void htmlAlternativeEscapesMarkupAndKeepsLineBreaks() {
    String html = JavaMailSenderMailer.toHtml("a < b & c\nnext");

    assertTrue(html.contains("a &lt; b &amp; c<br>next"));
    assertTrue(html.contains("white-space: pre-wrap"));
  }

  @Test
  void rejectsNullSender() {
    assertThrows(NullPointerException.class, () -> new JavaMailSenderMailer(null, null, null));
  }

  static class CapturingSender extends JavaMailSenderImpl {
    final List<MimeMessage> sent = new CopyOnWriteArrayList<>();
    private final String assignedId;

    CapturingSender(String assignedId) {
      this.assignedId = assignedId;
    }

    @Override
    protected void doSend(MimeMessage[] mimeMessages, Object[] originalMessages) throws MailException {
      for (MimeMessage message : mimeMessages) {
        if (assignedId != null) {
          try {
            message.setHeader("Message-ID", assignedId);
          } catch (MessagingException e) {
            throw new MailSendException("header", e);
          }
        }
        sent.add(message);
      }
    }
  }
}
