/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.common;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.primitives.Ints;

/**
 * Library settings read from a classpath properties resource. A system
 * property of the same name takes precedence over the resource value.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    public static final String DEFAULT_RESOURCE = "bittrie.properties";

    /**
     * Initial capacity of the explicit stacks used to traverse tries.
     */
    public static final String TRIE_STACK_SIZE_KEY = "bittrie.trie.stackSize";
    public static final int DEFAULT_TRIE_STACK_SIZE = 64;

    /**
     * Capacity of an LRU cache created without an explicit bound.
     */
    public static final String CACHE_CAPACITY_KEY = "bittrie.cache.capacity";
    public static final int DEFAULT_CACHE_CAPACITY = 1024;

    private static class ConfigurationLoader extends CacheLoader<String, Properties> {
        @Override
        public Properties load(String resource) throws IOException {
            Properties conf = new Properties();
            ClassLoader loader = Config.class.getClassLoader();
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    logger.config(() -> "Configuration resource " + resource + " not found, using defaults");
                } else {
                    conf.load(in);
                }
            }
            return conf;
        }
    }

    private static final LoadingCache<String, Properties> conf_cache =
        CacheBuilder.newBuilder().build(new ConfigurationLoader());

    private final Properties conf;

    public static Config getDefault() {
        return new Config(DEFAULT_RESOURCE);
    }

    public Config(String resource) {
        this.conf = conf_cache.getUnchecked(requireNonNull(resource));
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        Optional<String> val = get(name);
        if (!val.isPresent())
            return deflt;

        Integer result = Ints.tryParse(val.get().trim());
        if (result == null) {
            logger.log(Level.WARNING, "Ignoring invalid integer value \"{0}\" for {1}",
                       new Object[]{val.get(), name});
            return deflt;
        }
        return result;
    }

    public String toString() {
        return conf.toString();
    }
}
