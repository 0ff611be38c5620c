package com.chatguard.utils;

import org.junit.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import static org.junit.Assert.*;

public class StringUtilTest {

    @Test
    public void splitsCommaListDroppingBlanks() {
        List<String> items = StringUtil.splitCommaList(" 京 ,燕京,, ,北平");
        assertEquals(3, items.size());
        assertEquals("京", items.get(0));
        assertEquals("燕京", items.get(1));
        assertEquals("北平", items.get(2));

        assertTrue(StringUtil.splitCommaList(null).isEmpty());
        assertTrue(StringUtil.splitCommaList("  ").isEmpty());
    }

    @Test
    public void jsonKeepsHtmlCharacters() {
        assertEquals("\"<b>&</b>\"", StringUtil.toJson("<b>&</b>"));
    }

    @Test
    public void loadsPropertiesFromClasspath() throws Exception {
        Properties props = FileUtil.loadProperties("keyword-matcher.properties");
        assertEquals("300", props.getProperty("tag-keyword.ttl-seconds"));
    }

    @Test
    public void missingPropertiesAreEmpty() throws Exception {
        assertTrue(FileUtil.loadProperties("no-such-file.properties").isEmpty());
    }

    @Test
    public void missingResourceStreamIsNull() throws Exception {
        InputStream stream = FileUtil.findResourceAsStream("no-such-file.json");
        assertNull(stream);
    }
}
