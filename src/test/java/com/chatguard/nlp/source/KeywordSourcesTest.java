package com.chatguard.nlp.source;

import com.chatguard.api.data.GeoLocationRecord;
import com.chatguard.api.repository.ConfigurationUnavailableException;
import com.chatguard.api.repository.JsonKeywordRepository;
import com.chatguard.api.repository.TransactionMethodRepository;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.payload.DarkKeywordPayload;
import com.chatguard.nlp.payload.GeoLevel;
import com.chatguard.nlp.payload.GeoLocationPayload;
import com.chatguard.nlp.payload.KeywordDomain;
import com.chatguard.nlp.payload.TagKeywordPayload;
import com.chatguard.nlp.payload.TransactionMethodPayload;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class KeywordSourcesTest {

    private JsonKeywordRepository repository;

    @Before
    public void setUp() throws Exception {
        repository = JsonKeywordRepository.fromResource("keywords-test.json");
    }

    private static <T> List<String> keywords(List<KeywordEntry<T>> entries) {
        List<String> keywords = new ArrayList<>();
        for (KeywordEntry<T> entry : entries) keywords.add(entry.getKeyword());
        return keywords;
    }

    private static <T> Map<String, T> byKeyword(List<KeywordEntry<T>> entries) {
        Map<String, T> map = new HashMap<>();
        for (KeywordEntry<T> entry : entries) map.put(entry.getKeyword(), entry.getPayload());
        return map;
    }

    @Test
    public void transactionMethodsSkipInactiveAndBlankKeywords() throws Exception {
        TransactionMethodKeywordSource source = new TransactionMethodKeywordSource(repository);
        assertEquals(KeywordDomain.TRANSACTION_METHOD, source.getDomain());

        List<KeywordEntry<TransactionMethodPayload>> entries = source.fetch();
        List<String> expected = new ArrayList<>();
        expected.add("埋");
        expected.add("埋包");
        expected.add("快递");
        expected.add("顺丰");
        assertEquals(expected, keywords(entries));
        assertEquals("快递", byKeyword(entries).get("顺丰").getMethodName());
    }

    @Test
    public void darkKeywordsJoinActiveCategoryDrugAndKeyword() throws Exception {
        List<KeywordEntry<DarkKeywordPayload>> entries = new DarkKeywordSource(repository).fetch();

        List<String> expected = new ArrayList<>();
        expected.add("冰");
        expected.add("溜冰");
        expected.add("麻古");
        assertEquals(expected, keywords(entries));

        DarkKeywordPayload ice = byKeyword(entries).get("溜冰");
        assertEquals(101, ice.getKeywordId());
        assertEquals(10, ice.getDrugId());
        assertEquals("冰毒", ice.getDrugName());
        assertEquals(1, ice.getCategoryId());
        assertEquals("冰毒类", ice.getCategoryName());
        assertEquals(8, ice.getWeight());
        assertEquals(KeywordDomain.DARK_KEYWORD, ice.getDomain());
    }

    @Test
    public void geoLocationsEmitNameAliasesAndShortName() throws Exception {
        List<KeywordEntry<GeoLocationPayload>> entries = new GeoLocationKeywordSource(repository).fetch();
        Map<String, GeoLocationPayload> payloads = byKeyword(entries);

        assertTrue(payloads.containsKey("山东省"));
        assertTrue(payloads.containsKey("鲁"));
        assertTrue(payloads.containsKey("山东"));
        assertSame(payloads.get("山东省"), payloads.get("鲁"));

        assertTrue(payloads.containsKey("京"));
        assertTrue(payloads.containsKey("燕京"));
        assertFalse(payloads.containsKey("旧城"));
        assertFalse(payloads.containsKey("无效层级"));
        assertEquals(10, entries.size());
    }

    @Test
    public void geoLocationsResolveAncestorNames() throws Exception {
        Map<String, GeoLocationPayload> payloads =
            byKeyword(new GeoLocationKeywordSource(repository).fetch());

        GeoLocationPayload province = payloads.get("山东省");
        assertEquals(GeoLevel.PROVINCE, province.getLevel());
        assertNull(province.getParentName());
        assertNull(province.getProvinceName());

        GeoLocationPayload city = payloads.get("青岛");
        assertEquals("青岛市", city.getName());
        assertEquals("city", city.getType());
        assertEquals(Long.valueOf(1), city.getParentId());
        assertEquals("山东省", city.getParentName());
        assertEquals("山东省", city.getProvinceName());
        assertNull(city.getCityName());
        assertEquals(120.38, city.getLongitude(), 1e-9);

        GeoLocationPayload district = payloads.get("市南区");
        assertEquals("青岛市", district.getParentName());
        assertEquals("青岛市", district.getCityName());
        assertEquals("山东省", district.getProvinceName());
    }

    @Test
    public void keywordVariantsAreDistinctAndOrdered() {
        GeoLocationRecord record = new GeoLocationRecord();
        record.name = " 北京市 ";
        record.aliases = "京, 北京市 ,,燕京";
        record.shortName = "京";

        Set<String> expected = new LinkedHashSet<>();
        expected.add("北京市");
        expected.add("京");
        expected.add("燕京");
        assertEquals(expected, GeoLocationKeywordSource.keywordVariants(record));
    }

    @Test
    public void tagMappingsCarryTagAndFocusFlag() throws Exception {
        Map<String, TagKeywordPayload> payloads = byKeyword(new TagKeywordSource(repository).fetch());
        assertEquals(3, payloads.size());
        assertEquals(7, payloads.get("出货").getTagId());
        assertTrue(payloads.get("出货").isAutoFocus());
        assertFalse(payloads.get("有货").isAutoFocus());
        assertEquals(3, payloads.get("代购").getMappingId());
        assertFalse(payloads.containsKey("旧词"));
    }

    @Test(expected = ConfigurationUnavailableException.class)
    public void unavailableConfigurationPropagates() throws Exception {
        TransactionMethodRepository missing = () -> {
            throw new ConfigurationUnavailableException("no application context");
        };
        new TransactionMethodKeywordSource(missing).fetch();
    }

    @Test
    public void identicalRowsGiveEqualEntries() throws Exception {
        DarkKeywordSource source = new DarkKeywordSource(repository);
        assertEquals(source.fetch(), source.fetch());
    }
}
