package com.resona.cache.tier;

import com.resona.cache.CacheKey;
import org.apache.commons.codec.digest.DigestUtils;

final class TestKeys {

    private TestKeys() {
    }

    static CacheKey key(String name) {
        return new CacheKey(DigestUtils.sha256Hex(name));
    }
}
