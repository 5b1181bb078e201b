package fanout.spring.boot;

import fanout.spi.Mailer;
import fanout.spi.MailerException;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Mailer} backed by Spring's {@link JavaMailSender}.
 *
 * <p>Each message carries the plain-text body and an HTML alternative that preserves line
 * breaks. The returned id is the {@code Message-ID} header assigned on send, or a generated
 * id when the transport assigned none.
 */
public class JavaMailSenderMailer implements Mailer {
  private static final Logger logger = Logger.getLogger(JavaMailSenderMailer.class.getName());

  private final JavaMailSender mailSender;
  private final String fromAddress;
  private final String fromName;

  public JavaMailSenderMailer(JavaMailSender mailSender, String fromAddress, String fromName) {
    this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
    this.fromAddress = fromAddress;
    this.fromName = fromName;
  }

  @Override
  public String send(String to, String subject, String body) throws MailerException {
    MimeMessage message = mailSender.createMimeMessage();
    try {
      MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
      if (fromAddress != null && !fromAddress.isBlank()) {
        if (fromName != null && !fromName.isBlank()) {
          helper.setFrom(fromAddress, fromName);
        } else {
          helper.setFrom(fromAddress);
        }
      }
      helper.setTo(to);
      helper.setSubject(subject);
      helper.setText(body, toHtml(body));
      mailSender.send(message);
      String messageId = message.getMessageID();
      if (messageId == null) {
        messageId = "<" + UUID.randomUUID() + "@fanout>";
      }
      logger.log(Level.FINE, "Sent email to {0}, messageId={1}", new Object[]{to, messageId});
      return messageId;
    } catch (MessagingException | UnsupportedEncodingException | MailException e) {
      throw new MailerException("Failed to send email to " + to + ": " + e.getMessage(), e);
    }
  }

  static String toHtml(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 256);
    sb.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"></head>")
        .append("<body style=\"font-family: Arial, sans-serif; line-height: 1.6; color: #333;")
        .append(" max-width: 600px; margin: 0 auto; padding: 20px;\">")
        .append("<div style=\"white-space: pre-wrap;\">");
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '&' -> sb.append("&amp;");
        case '"' -> sb.append("&quot;");
        case '\n' -> sb.append("<br>");
        default -> sb.append(c);
      }
    }
    return sb.append("</div></body></html>").toString();
  }
}
