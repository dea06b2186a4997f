package io.b2mash.commerce.notification;

import io.b2mash.commerce.event.PaymentStatusChangedEvent;
import io.b2mash.commerce.payment.PaymentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * Plain-text payment status emails. Skipped (and logged) when no mail server is configured or the
 * payment has no customer email.
 */
@Service
public class PaymentEmailService {

  private static final Logger log = LoggerFactory.getLogger(PaymentEmailService.class);

  private final ObjectProvider<JavaMailSender> mailSender;
  private final String fromAddress;

  public PaymentEmailService(
      ObjectProvider<JavaMailSender> mailSender,
      @Value("${commerce.mail.from:no-reply@localhost}") String fromAddress) {
    this.mailSender = mailSender;
    this.fromAddress = fromAddress;
  }

  /** Returns {@code true} when the email was handed to the mail server. */
  public boolean emailOnPaymentStatus(PaymentStatusChangedEvent event) {
    if (event.customerEmail() == null || event.customerEmail().isBlank()) {
      log.info("Payment {} has no customer email, skipping status email", event.entityId());
      return false;
    }
    var sender = mailSender.getIfAvailable();
    if (sender == null) {
      log.info(
          "Mail is not configured, skipping {} email for payment {}",
          event.status(),
          event.entityId());
      return false;
    }

    var message = new SimpleMailMessage();
    message.setFrom(fromAddress);
    message.setTo(event.customerEmail());
    message.setSubject(subject(event));
    message.setText(body(event));
    sender.send(message);
    log.info("Sent {} email for payment {}", event.status(), event.entityId());
    return true;
  }

  static String subject(PaymentStatusChangedEvent event) {
    var what = event.paymentType() == PaymentType.SUBSCRIPTION ? "subscription" : "order";
    return switch (event.status()) {
      case PAID -> "Payment received for your " + what;
      case FAILED -> "Payment failed for your " + what;
      case CANCELLED -> "Payment cancelled for your " + what;
      case REFUNDED -> "Refund issued for your " + what;
      case PENDING -> "Payment pending for your " + what;
    };
  }

  static String body(PaymentStatusChangedEvent event) {
    var text = new StringBuilder();
    text.append("Hello,\n\n")
        .append("Your payment of ")
        .append(event.amount().toPlainString())
        .append(' ')
        .append(event.currency())
        .append(" is now ")
        .append(event.status().name().toLowerCase())
        .append(".\n");
    if (event.reason() != null) {
      text.append("Details: ").append(event.reason()).append('\n');
    }
    text.append("\nPayment reference: ").append(event.entityId()).append('\n');
    return text.toString();
  }
}
