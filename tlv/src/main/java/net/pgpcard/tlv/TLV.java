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

import java.util.*;

// A single BER-TLV element, either primitive (value) or constructed (children)
public final class TLV {
    private final BERTag tag;
    private final byte[] value;
    private final List<TLV> children;
    private TLV parent;

    TLV(BERTag tag, byte[] value, List<TLV> children) {
        this.tag = Objects.requireNonNull(tag, "tag cannot be null");
        this.value = value;
        this.children = children == null ? new ArrayList<>() : children;
    }

    public static TLV of(BERTag tag, byte[] value) {
        if (tag.isConstructed()) {
            return new TLV(tag, null, new ArrayList<>(TLVParser.parse(value)));
        }
        return new TLV(tag, value.clone(), null);
    }

    public static TLV of(String tag, byte[] value) {
        return of(BERTag.of(tag), value);
    }

    public static TLV of(BERTag tag, TLV... tlvs) {
        var parent = build(tag);
        for (var tlv : tlvs) {
            parent.add(tlv);
        }
        return parent;
    }

    // Fluent builder for constructed TLV
    public static TLV build(BERTag tag) {
        Objects.requireNonNull(tag, "tag");
        if (!tag.isConstructed()) {
            throw new IllegalArgumentException("Tag " + tag + " is not constructed");
        }
        return new TLV(tag, null, new ArrayList<>());
    }

    public static TLV build(String tagHex) {
        return build(BERTag.of(tagHex));
    }

    public BERTag tag() {
        return tag;
    }

    // Primitive value, or the encoded children of a constructed element
    public byte[] value() {
        if (value != null) {
            return value.clone();
        }
        var out = new byte[0];
        for (var child : children) {
            var kid = child.encode();
            var joined = Arrays.copyOf(out, out.length + kid.length);
            System.arraycopy(kid, 0, joined, out.length, kid.length);
            out = joined;
        }
        return out;
    }

    public List<TLV> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isConstructed() {
        return value == null;
    }

    public TLV add(TLV tlv) {
        Objects.requireNonNull(tlv, "tlv");
        if (value != null) {
            throw new IllegalStateException("Cannot add children to primitive TLV");
        }
        tlv.parent = this;
        children.add(tlv);
        return this;
    }

    public TLV add(String childTagHex, byte[] value) {
        Objects.requireNonNull(value, "value");
        return add(TLV.of(childTagHex, value));
    }

    // Opens a nested constructed element, return with end()
    public TLV open(String childTagHex) {
        var child = build(childTagHex);
        add(child);
        return child;
    }

    public TLV end() {
        if (parent == null) {
            throw new IllegalStateException("No parent to return to");
        }
        return parent;
    }

    public Optional<TLV> find(BERTag t) {
        if (tag.equals(t)) {
            return Optional.of(this);
        }
        for (var child : children) {
            var r = child.find(t);
            if (r.isPresent()) {
                return r;
            }
        }
        return Optional.empty();
    }

    public byte[] encode() {
        return TLVEncoder.encode(this);
    }

    public static List<TLV> parse(byte[] data) {
        return TLVParser.parse(data);
    }

    private static void visualize(TLV tlv, int indent, List<String> list) {
        if (tlv.isConstructed()) {
            list.add(" ".repeat(indent) + tlv.tag);
            int tagLen = tlv.tag.bytes().length;
            for (var t : tlv.children) {
                visualize(t, indent + tagLen * 2 + 2, list);
            }
        } else {
            list.add(" ".repeat(indent) + tlv.tag + " " + HexFormat.of().withUpperCase().formatHex(tlv.value));
        }
    }

    public List<String> visualize() {
        var result = new ArrayList<String>();
        visualize(this, 0, result);
        return result;
    }

    @Override
    public String toString() {
        return String.join("\n", visualize());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TLV other
                && this.tag.equals(other.tag)
                && Arrays.equals(this.value, other.value)
                && this.children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.tag, Arrays.hashCode(this.value), this.children);
    }
}
