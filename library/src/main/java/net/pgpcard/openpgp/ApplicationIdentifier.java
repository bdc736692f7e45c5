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

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.TOO_SHORT;

/**
 * Application identifier of the OpenPGP application (4.2.1).
 * <p>
 * Layout: RID (5 bytes), application (1), version (2), manufacturer (2), serial number (4), RFU (2).
 */
public record ApplicationIdentifier(String rid, String application, String version, String manufacturer, String serial, long serialInt) {
    static final int MINIMUM_LENGTH = 14;
    static final int OPENPGP_APPLICATION = 0x01;

    public static ApplicationIdentifier parse(byte[] aid) {
        if (aid.length < MINIMUM_LENGTH) {
            throw new OpenPGPDataException(TOO_SHORT, "Application identifier shorter than %d bytes".formatted(MINIMUM_LENGTH), aid);
        }
        var rid = Hex.toHexString(aid, 0, 5).toUpperCase();

        var application = Hex.toHexString(aid, 5, 1).toUpperCase();
        if (aid[5] == OPENPGP_APPLICATION) {
            application += " (OpenPGP)";
        }

        var version = "%X.%X".formatted(aid[6], aid[7]);

        var manufacturer = "%02X%02X".formatted(aid[8], aid[9]);
        if (aid[8] == 0x00 && aid[9] == 0x06) {
            manufacturer += " (YubiCo)";
        }

        var serial = "%X%02X%02X%02X".formatted(aid[10], aid[11], aid[12], aid[13]);
        long serialInt = 0;
        for (byte b : Arrays.copyOfRange(aid, 10, 14)) {
            serialInt = (serialInt << 8) | (b & 0xFF);
        }
        return new ApplicationIdentifier(rid, application, version, manufacturer, serial, serialInt);
    }
}
