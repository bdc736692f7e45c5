/*
 * Copyright (c) 2025 Martin Paljak
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.pgpcard.tlv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Flattened view of parsed BER-TLV data, addressing every element by its dotted tag path.
 * <p>
 * A path like {@code 6E.73.C5} names the element with tag {@code C5} inside {@code 73} inside {@code 6E}.
 * Constructed elements get an entry as well, holding their encoded content. Instances are immutable.
 */
public final class TagMap {
    private static final Logger logger = LoggerFactory.getLogger(TagMap.class);

    public static final String SEPARATOR = ".";

    private static final TagMap EMPTY = new TagMap(Map.of());

    private final Map<String, byte[]> values;

    private TagMap(Map<String, byte[]> values) {
        this.values = values;
    }

    public static TagMap empty() {
        return EMPTY;
    }

    /**
     * Parses a byte stream of one or more BER-TLV elements.
     *
     * @throws TLVParseException if the stream is truncated or malformed
     */
    public static TagMap parse(byte[] data) {
        Objects.requireNonNull(data, "data");
        return of(TLVParser.parse(data));
    }

    public static TagMap of(List<TLV> tlvs) {
        var result = new LinkedHashMap<String, byte[]>();
        for (var tlv : tlvs) {
            flatten(tlv, "", result);
        }
        if (logger.isTraceEnabled()) {
            tlvs.forEach(t -> t.visualize().forEach(logger::trace));
        }
        return new TagMap(Collections.unmodifiableMap(result));
    }

    private static void flatten(TLV tlv, String prefix, Map<String, byte[]> result) {
        var path = prefix + tlv.tag().toHex();
        if (result.containsKey(path)) {
            logger.debug("Ignoring repeated tag path {}", path);
            return;
        }
        result.put(path, tlv.value());
        for (var child : tlv.children()) {
            flatten(child, path + SEPARATOR, result);
        }
    }

    // Joins tags into a path, for example path("6E", "73", "C5") is "6E.73.C5"
    public static String path(String... tags) {
        return String.join(SEPARATOR, Arrays.stream(tags).map(String::toUpperCase).toList());
    }

    public boolean has(String path) {
        return values.containsKey(normalize(path));
    }

    public OptionalInt length(String path) {
        var v = values.get(normalize(path));
        return v == null ? OptionalInt.empty() : OptionalInt.of(v.length);
    }

    public Optional<byte[]> get(String path) {
        return Optional.ofNullable(values.get(normalize(path))).map(byte[]::clone);
    }

    public Set<String> paths() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // Entries of this mapping take precedence over those of other
    public TagMap merge(TagMap other) {
        var result = new LinkedHashMap<>(values);
        other.values.forEach(result::putIfAbsent);
        return new TagMap(Collections.unmodifiableMap(result));
    }

    private static String normalize(String path) {
        return path.toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof TagMap other) || other.values.size() != values.size()) {
            return false;
        }
        for (var e : values.entrySet()) {
            if (!Arrays.equals(e.getValue(), other.values.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (var e : values.entrySet()) {
            h += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        var sb = new StringJoiner(", ", "TagMap{", "}");
        values.forEach((k, v) -> sb.add(k + "=" + HexFormat.of().withUpperCase().formatHex(v)));
        return sb.toString();
    }
}
