package com.chatguard.nlp.extraction;

import com.chatguard.api.data.PriceMention;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PriceExtractorTest {

    private final PriceExtractor extractor = PriceExtractor.getInstance();

    @Test
    public void extractsUnitPrice() {
        List<PriceMention> prices = extractor.extract("老价格 100元/克 要的私聊");
        assertEquals(1, prices.size());
        PriceMention price = prices.get(0);
        assertEquals(100.0, price.getValue(), 1e-9);
        assertEquals(PriceExtractor.UNIT_GRAM, price.getUnit());
        assertEquals("100元/克", price.getOriginalText());
        assertEquals(0.95, price.getConfidence(), 1e-9);
    }

    @Test
    public void mapsUnitWords() {
        List<PriceMention> prices = extractor.extract("50块 一份80份 20条 30片");
        assertEquals(4, prices.size());
        assertEquals(PriceExtractor.UNIT_PIECE, prices.get(0).getUnit());
        assertEquals(PriceExtractor.UNIT_PORTION, prices.get(1).getUnit());
        assertEquals(80.0, prices.get(1).getValue(), 1e-9);
        assertEquals(PriceExtractor.UNIT_STICK, prices.get(2).getUnit());
        assertEquals(PriceExtractor.UNIT_TABLET, prices.get(3).getUnit());
    }

    @Test
    public void rangeIsReportedAsMean() {
        List<PriceMention> prices = extractor.extract("100-200元");
        assertEquals(1, prices.size());
        assertEquals(150.0, prices.get(0).getValue(), 1e-9);
        assertEquals(PriceExtractor.UNIT_GRAM, prices.get(0).getUnit());
        assertEquals("100-200元", prices.get(0).getOriginalText());

        prices = extractor.extract("300 ~ 400 ￥");
        assertEquals(1, prices.size());
        assertEquals(350.0, prices.get(0).getValue(), 1e-9);
    }

    @Test
    public void dropsValuesOutOfRange() {
        assertTrue(extractor.extract("0.5克").isEmpty());
        assertTrue(extractor.extract("200000克").isEmpty());
        assertEquals(1, extractor.extract("100000克").size());
    }

    @Test
    public void roundsToTwoDecimals() {
        List<PriceMention> prices = extractor.extract("3.456克");
        assertEquals(3.46, prices.get(0).getValue(), 1e-9);
    }

    @Test
    public void keepsFirstMentionOfSameValueAndUnit() {
        List<PriceMention> prices = extractor.extract("100克，还是100元/克");
        assertEquals(1, prices.size());
        assertEquals("100克", prices.get(0).getOriginalText());
    }

    @Test
    public void readsFullWidthDigitsAndSpaces() {
        List<PriceMention> prices = extractor.extract("今天１００元/克，量大１５０\u3000块");
        assertEquals(2, prices.size());
        assertEquals(100.0, prices.get(0).getValue(), 1e-9);
        assertEquals("１００元/克", prices.get(0).getOriginalText());
        assertEquals(150.0, prices.get(1).getValue(), 1e-9);
        assertEquals(PriceExtractor.UNIT_PIECE, prices.get(1).getUnit());

        prices = extractor.extract("１００-２００元");
        assertEquals(1, prices.size());
        assertEquals(150.0, prices.get(0).getValue(), 1e-9);
    }

    @Test
    public void blankTextYieldsNothing() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
        assertTrue(extractor.extract("没有价格").isEmpty());
    }
}
