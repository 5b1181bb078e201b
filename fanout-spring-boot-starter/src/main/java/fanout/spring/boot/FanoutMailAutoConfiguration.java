package fanout.spring.boot;

import fanout.spi.Mailer;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * Provides a {@link JavaMailSenderMailer} over the application's {@link JavaMailSender} unless
 * a {@link Mailer} bean is already defined.
 */
@AutoConfiguration(after = MailSenderAutoConfiguration.class)
@ConditionalOnClass(JavaMailSender.class)
@ConditionalOnBean(JavaMailSender.class)
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutMailAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Mailer.class)
  public JavaMailSenderMailer fanoutMailer(JavaMailSender mailSender, FanoutProperties props) {
    return new JavaMailSenderMailer(mailSender, props.getMail().getFromAddress(), props.getMail().getFromName());
  }
}
