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
package net.pgpcard.openpgp;

import net.pgpcard.tlv.TagMap;

// Tag paths of the data objects read from the card, as flattened by TagMap.
// See "Functional Specification of the OpenPGP application on ISO Smart Card Operating Systems" v3.4, 4.4.1
public final class OpenPGPTags {
    private OpenPGPTags() {}

    public static final String APPLICATION_RELATED_DATA = "6E";
    public static final String APPLICATION_IDENTIFIER = TagMap.path(APPLICATION_RELATED_DATA, "4F");
    public static final String HISTORICAL_BYTES = TagMap.path(APPLICATION_RELATED_DATA, "5F52");

    static final String DISCRETIONARY_DATA = TagMap.path(APPLICATION_RELATED_DATA, "73");
    public static final String EXTENDED_CAPABILITIES = TagMap.path(DISCRETIONARY_DATA, "C0");
    public static final String SIGNATURE_ALGORITHM_ATTRIBUTES = TagMap.path(DISCRETIONARY_DATA, "C1");
    public static final String DECRYPTION_ALGORITHM_ATTRIBUTES = TagMap.path(DISCRETIONARY_DATA, "C2");
    public static final String AUTHENTICATION_ALGORITHM_ATTRIBUTES = TagMap.path(DISCRETIONARY_DATA, "C3");
    public static final String PW_STATUS_BYTES = TagMap.path(DISCRETIONARY_DATA, "C4");
    public static final String FINGERPRINTS = TagMap.path(DISCRETIONARY_DATA, "C5");
    public static final String CA_FINGERPRINTS = TagMap.path(DISCRETIONARY_DATA, "C6");
    public static final String GENERATION_DATES = TagMap.path(DISCRETIONARY_DATA, "CD");
    public static final String KEY_INFORMATION = TagMap.path(DISCRETIONARY_DATA, "DE");

    public static final String CARDHOLDER_RELATED_DATA = "65";
    public static final String CARDHOLDER_NAME = TagMap.path(CARDHOLDER_RELATED_DATA, "5B");
    public static final String LANGUAGE_PREFERENCES = TagMap.path(CARDHOLDER_RELATED_DATA, "5F2D");

    public static final String SECURITY_SUPPORT_TEMPLATE = "7A";
    public static final String SIGNATURE_COUNTER = TagMap.path(SECURITY_SUPPORT_TEMPLATE, "93");

    static final int FINGERPRINT_LENGTH = 20;
    static final int DATE_LENGTH = 4;
}
