package jerrinot.info.unitengine.framework;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * System properties and default locales changed during a test, restored when the test ends.
 */
final class ScopedSettings {

    private final Map<String, String> systemProperties = new LinkedHashMap<>();
    private final Map<Locale.Category, Locale> locales = new EnumMap<>(Locale.Category.class);
    private Locale defaultLocale;

    void setSystemProperty(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (!systemProperties.containsKey(key)) {
            systemProperties.put(key, System.getProperty(key));
        }
        if (value == null) {
            System.clearProperty(key);
        } else {
            System.setProperty(key, value);
        }
    }

    void setLocale(Locale locale) {
        Objects.requireNonNull(locale, "locale");
        backupLocales();
        Locale.setDefault(locale);
    }

    void setLocale(Locale.Category category, Locale locale) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(locale, "locale");
        backupLocales();
        Locale.setDefault(category, locale);
    }

    boolean isEmpty() {
        return systemProperties.isEmpty() && defaultLocale == null;
    }

    void restore() {
        for (Map.Entry<String, String> e : systemProperties.entrySet()) {
            if (e.getValue() == null) {
                System.clearProperty(e.getKey());
            } else {
                System.setProperty(e.getKey(), e.getValue());
            }
        }
        systemProperties.clear();
        if (defaultLocale != null) {
            Locale.setDefault(defaultLocale);
            for (Map.Entry<Locale.Category, Locale> e : locales.entrySet()) {
                Locale.setDefault(e.getKey(), e.getValue());
            }
            defaultLocale = null;
            locales.clear();
        }
    }

    private void backupLocales() {
        if (defaultLocale != null) {
            return;
        }
        defaultLocale = Locale.getDefault();
        for (Locale.Category category : Locale.Category.values()) {
            locales.put(category, Locale.getDefault(category));
        }
    }
}
