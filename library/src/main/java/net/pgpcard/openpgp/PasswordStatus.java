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

import net.pgpcard.openpgp.data.ByteLocation;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.TOO_SHORT;

/**
 * PW Status Bytes ({@code 6E.73.C4}).
 *
 * @param pw1ValidForMultipleSignatures byte 1: PW1 stays verified after the first PSO:CDS
 * @param pw1MaxLength                  byte 2, format bit masked off
 * @param rcMaxLength                   byte 3
 * @param pw3MaxLength                  byte 4
 * @param pw1Retries                    byte 5
 * @param rcRetries                     byte 6
 * @param pw3Retries                    byte 7
 */
public record PasswordStatus(boolean pw1ValidForMultipleSignatures, int pw1MaxLength, int rcMaxLength, int pw3MaxLength,
                             int pw1Retries, int rcRetries, int pw3Retries) {
    static final int LENGTH = 7;

    public static PasswordStatus parse(byte[] data) {
        if (data.length < LENGTH) {
            throw new OpenPGPDataException(TOO_SHORT, "PW status bytes shorter than " + LENGTH, data);
        }
        return new PasswordStatus(
                ByteLocation.at(data, 1) == 0x01,
                ByteLocation.at(data, 2) & 0x7F,
                ByteLocation.at(data, 3) & 0xFF,
                ByteLocation.at(data, 4) & 0xFF,
                ByteLocation.at(data, 5) & 0xFF,
                ByteLocation.at(data, 6) & 0xFF,
                ByteLocation.at(data, 7) & 0xFF);
    }
}
