/* Copyright (C) 2026 – ChomskyKit contributors
 * This file is part of ChomskyKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.chomskykit.setting;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import de.chomskykit.api.logging.AnalysisLogger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Global, read-only access to the configuration of the toolkit.
 * <p>
 * Values are read once from the classpath resource {@value #RESOURCE_NAME} and overridden by the {@link System}
 * properties of the same keys. Values that cannot be parsed are reported and replaced by the caller's default.
 */
public final class ChomskyKitSettings {

    public static final String RESOURCE_NAME = "chomskykit.properties";

    private static final AnalysisLogger LOGGER = AnalysisLogger.getLogger(ChomskyKitSettings.class);

    private static final ChomskyKitSettings INSTANCE = new ChomskyKitSettings(loadDefaultProperties());

    private final Properties properties;

    ChomskyKitSettings(Properties properties) {
        this.properties = properties;
    }

    public static ChomskyKitSettings getInstance() {
        return INSTANCE;
    }

    private static Properties loadDefaultProperties() {
        final Properties props = new Properties();
        final ClassLoader loader = ChomskyKitSettings.class.getClassLoader();

        try (InputStream is = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE_NAME, e);
        }

        for (ChomskyKitProperty property : ChomskyKitProperty.values()) {
            final String value = System.getProperty(property.getPropertyKey());
            if (value != null) {
                props.setProperty(property.getPropertyKey(), value);
            }
        }

        return props;
    }

    public @Nullable String getProperty(ChomskyKitProperty property) {
        return properties.getProperty(property.getPropertyKey());
    }

    public String getProperty(ChomskyKitProperty property, String defaultValue) {
        return properties.getProperty(property.getPropertyKey(), defaultValue);
    }

    public @Nullable Integer getInteger(ChomskyKitProperty property) {
        final String prop = getProperty(property);
        if (prop == null) {
            return null;
        }
        try {
            return Integer.parseInt(prop.trim());
        } catch (NumberFormatException ex) {
            LOGGER.logFinding("Could not parse integer value '" + prop + "' of property " + property);
            return null;
        }
    }

    public int getInt(ChomskyKitProperty property, int defaultValue) {
        final Integer value = getInteger(property);
        return value != null ? value : defaultValue;
    }

    public long getLong(ChomskyKitProperty property, long defaultValue) {
        final String prop = getProperty(property);
        if (prop == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(prop.trim());
        } catch (NumberFormatException ex) {
            LOGGER.logFinding("Could not parse long value '" + prop + "' of property " + property);
            return defaultValue;
        }
    }
}
