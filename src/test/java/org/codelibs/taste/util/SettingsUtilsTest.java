package org.codelibs.taste.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.HashMap;
import java.util.Map;

import org.codelibs.taste.exception.InvalidParameterException;
import org.junit.Test;

public class SettingsUtilsTest {

    @Test
    public void test_get() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("name", "value");
        assertEquals("value", SettingsUtils.get(settings, "name"));
        assertNull(SettingsUtils.get(settings, "other"));
        assertEquals("default", SettingsUtils.get(settings, "other", "default"));
        assertEquals("default", SettingsUtils.get(null, "name", "default"));
    }

    @Test
    public void test_getInt() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("number", 12);
        settings.put("text", " 34 ");
        settings.put("long", 56L);
        assertEquals(12, SettingsUtils.getInt(settings, "number", 0));
        assertEquals(34, SettingsUtils.getInt(settings, "text", 0));
        assertEquals(56, SettingsUtils.getInt(settings, "long", 0));
        assertEquals(7, SettingsUtils.getInt(settings, "missing", 7));
    }

    @Test
    public void test_getDouble() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("number", 0.5f);
        settings.put("text", "0.97");
        assertEquals(0.5, SettingsUtils.getDouble(settings, "number", 0), 0.0);
        assertEquals(0.97, SettingsUtils.getDouble(settings, "text", 0), 0.0);
        assertEquals(1.5, SettingsUtils.getDouble(settings, "missing", 1.5),
                0.0);
    }

    @Test
    public void test_getString() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("text", " full ");
        settings.put("blank", " ");
        assertEquals("full", SettingsUtils.getString(settings, "text", null));
        assertEquals("x", SettingsUtils.getString(settings, "blank", "x"));
        assertEquals("x", SettingsUtils.getString(settings, "missing", "x"));
    }

    @Test(expected = InvalidParameterException.class)
    public void test_invalidInt() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("text", "1.5");
        SettingsUtils.getInt(settings, "text", 0);
    }

    @Test(expected = InvalidParameterException.class)
    public void test_fractionalNumberAsInt() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("number", 50.5);
        SettingsUtils.getInt(settings, "number", 0);
    }

    @Test(expected = InvalidParameterException.class)
    public void test_longOutOfIntRange() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("number", 1L + Integer.MAX_VALUE);
        SettingsUtils.getInt(settings, "number", 0);
    }

    @Test
    public void test_integralDoubleAsInt() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("number", 50.0);
        assertEquals(50, SettingsUtils.getInt(settings, "number", 0));
    }

    @Test(expected = InvalidParameterException.class)
    public void test_invalidDouble() {
        final Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("text", "high");
        SettingsUtils.getDouble(settings, "text", 0);
    }
}
