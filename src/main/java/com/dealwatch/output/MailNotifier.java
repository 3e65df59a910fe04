package com.dealwatch.output;

import com.dealwatch.model.OfferRecord;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

public final class MailNotifier implements DealNotifier {
    private static final Logger LOG = LogManager.getLogger(MailNotifier.class);

    private final Mailer mailer;
    private final Mailer.Settings settings;
    private final DealMailRenderer renderer;

    public MailNotifier(Mailer mailer, Mailer.Settings settings) {
        this.mailer = mailer;
        this.settings = settings;
        this.renderer = new DealMailRenderer(settings.subjectPrefix);
    }

    @Override
    public boolean send(List<OfferRecord> deals) {
        if (deals == null || deals.isEmpty()) {
            return true;
        }
        String subject = renderer.subject(deals);
        try {
            boolean sent = mailer.send(settings, subject, renderer.text(deals), renderer.html(deals));
            if (sent) {
                LOG.info("Sent alert for {} deal(s)", deals.size());
            }
            return sent;
        } catch (MessagingException e) {
            LOG.error("Failed to send deal alert '{}': {}", subject, e.getMessage(), e);
            return false;
        }
    }
}
