package com.dealwatch.output;

import com.dealwatch.model.OfferRecord;
import com.dealwatch.model.Price;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DealMailRendererTest {

    private final DealMailRenderer renderer = new DealMailRenderer("Kindle Alert:");

    @Test
    void subjectShouldCountDeals() {
        assertEquals("Kindle Alert: 2 new e-reader deal(s) on Woot!",
                renderer.subject(List.of(deal("1", "A"), deal("2", "B"))));
        assertEquals("Kindle Alert: 0 new e-reader deal(s) on Woot!", new DealMailRenderer(" ").subject(null));
    }

    @Test
    void textShouldListTitleAndUrlSeparatedByBlankLines() {
        String text = renderer.text(List.of(deal("1", "Kindle Basic"), deal("2", "Kobo Clara")));

        assertEquals("Kindle Basic - https://woot.test/1\n\nKobo Clara - https://woot.test/2", text);
    }

    @Test
    void htmlShouldShowSavingsDescriptionAndLink() {
        OfferRecord record = deal("1", "Kindle <Paperwhite>").toBuilder()
                .salePrice(Price.scalar(89.99))
                .listPrice(Price.scalar(139.99))
                .writeUpIntro("Read & relax")
                .build();

        String html = renderer.html(List.of(record));

        assertTrue(html.contains("<h2>Kindle &lt;Paperwhite&gt;</h2>"));
        assertTrue(html.contains("<strong>Price:</strong> $89.99 (Save $50.00)"));
        assertTrue(html.contains("<p>Read &amp; relax</p>"));
        assertTrue(html.contains("<a href=\"https://woot.test/1\">View on Woot!</a>"));
        assertTrue(html.contains(DealMailRenderer.FOOTER));
    }

    @Test
    void priceLineShouldHandleMissingAndTieredPrices() {
        assertEquals("Price unknown", DealMailRenderer.priceLine(deal("1", "x")));

        OfferRecord tiered = deal("2", "y").toBuilder()
                .salePrice(Price.tiered(List.of(79.0, 69.0)))
                .listPrice(Price.scalar(60.0))
                .build();
        assertEquals("$69.00", DealMailRenderer.priceLine(tiered));
    }

    @Test
    void descriptionShouldFallBackToSnippetAndTruncate() {
        String longText = "x".repeat(250);
        OfferRecord record = deal("1", "t").toBuilder().snippet(longText).build();

        String description = DealMailRenderer.description(record);

        assertEquals(200, description.length());
        assertTrue(description.endsWith("..."));
        assertFalse(DealMailRenderer.description(deal("2", "t").toBuilder().snippet("short").build()).endsWith("..."));
    }

    private static OfferRecord deal(String id, String title) {
        return OfferRecord.builder()
                .id(id)
                .offerId(id)
                .title(title)
                .url("https://woot.test/" + id)
                .rawText(Map.of())
                .build();
    }
}
