package com.dealwatch.output;

import com.dealwatch.model.OfferRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders the deal alert mail: subject, plain-text body and HTML body.
 */
public final class DealMailRenderer {
    static final int DESCRIPTION_LIMIT = 200;
    static final String FOOTER = "Sent by your Woot Kindle Deals alert system";

    private final String subjectPrefix;

    public DealMailRenderer(String subjectPrefix) {
        String prefix = subjectPrefix == null ? "" : subjectPrefix.trim();
        this.subjectPrefix = prefix.isEmpty() ? "Kindle Alert:" : prefix;
    }

    public String subject(List<OfferRecord> deals) {
        int count = deals == null ? 0 : deals.size();
        return subjectPrefix + " " + count + " new e-reader deal(s) on Woot!";
    }

    public String text(List<OfferRecord> deals) {
        if (deals == null || deals.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>(deals.size());
        for (OfferRecord deal : deals) {
            lines.add(safe(deal.title) + " - " + safe(deal.url));
        }
        return String.join("\n\n", lines);
    }

    public String html(List<OfferRecord> deals) {
        StringBuilder sb = new StringBuilder();
        sb.append("<html><body>");
        if (deals != null) {
            for (OfferRecord deal : deals) {
                sb.append("<h2>").append(escape(deal.title)).append("</h2>");
                sb.append("<p><strong>Price:</strong> ").append(escape(priceLine(deal))).append("</p>");
                sb.append("<p>").append(escape(description(deal))).append("</p>");
                String url = safe(deal.url).trim();
                if (!url.isEmpty()) {
                    sb.append("<p><a href=\"").append(escape(url)).append("\">View on Woot!</a></p>");
                }
                sb.append("<hr>");
            }
        }
        sb.append("<p><small>").append(FOOTER).append("</small></p>");
        sb.append("</body></html>");
        return sb.toString();
    }

    static String priceLine(OfferRecord deal) {
        if (deal.salePrice == null) {
            return "Price unknown";
        }
        String sale = money(deal.salePrice.representative());
        OptionalDouble savings = deal.savings();
        if (savings.isPresent()) {
            return sale + " (Save " + money(savings.getAsDouble()) + ")";
        }
        return sale;
    }

    static String description(OfferRecord deal) {
        String text = safe(deal.writeUpIntro).trim();
        if (text.isEmpty()) {
            text = safe(deal.snippet).trim();
        }
        if (text.length() > DESCRIPTION_LIMIT) {
            return text.substring(0, DESCRIPTION_LIMIT - 3) + "...";
        }
        return text;
    }

    static String escape(String raw) {
        String value = safe(raw);
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#39;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String money(double amount) {
        return String.format(Locale.US, "$%.2f", amount);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
