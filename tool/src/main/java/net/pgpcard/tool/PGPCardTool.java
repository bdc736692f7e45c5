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
package net.pgpcard.tool;

import joptsimple.OptionException;
import joptsimple.OptionSet;
import net.pgpcard.openpgp.ExtendedCapabilities;
import net.pgpcard.openpgp.KeyType;
import net.pgpcard.openpgp.OpenPGPCard;
import net.pgpcard.openpgp.OpenPGPException;
import net.pgpcard.openpgp.OpenPGPTags;
import net.pgpcard.tlv.TLV;
import net.pgpcard.tlv.TagMap;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

// Does the CLI parameter parsing and associated execution
public final class PGPCardTool extends PGPCardCommandLineInterface {
    // NOTE: can't have a logger here, as it is set up based on args and env. This class should only use stdout/stderr.

    static final String ENV_PGPCARD_READER = "PGPCARD_READER";
    static final String ENV_PGPCARD_TRACE = "PGPCARD_TRACE";
    static final String DEFAULT_READER = "Unknown reader";

    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> env;

    private boolean isVerbose = false;
    private boolean isTrace = false;

    public PGPCardTool(PrintStream out, PrintStream err, Map<String, String> env) {
        this.out = out;
        this.err = err;
        this.env = env;
    }

    public static void main(String[] argv) {
        System.exit(new PGPCardTool(System.out, System.err, System.getenv()).run(argv));
    }

    void setupLogging(OptionSet args) {
        // Set up slf4j simple in a way that pleases us
        System.setProperty("org.slf4j.simpleLogger.showThreadName", "false");
        System.setProperty("org.slf4j.simpleLogger.levelInBrackets", "true");
        System.setProperty("org.slf4j.simpleLogger.showShortLogName", "true");
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "warn");

        if (args.has(OPT_VERBOSE)) {
            isVerbose = true;
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        }
        if (args.has(OPT_DEBUG))
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        if (args.has(OPT_DEBUG) && env.containsKey(ENV_PGPCARD_TRACE)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "trace");
            isTrace = true;
        }
    }

    public static String getVersion() {
        Properties prop = new Properties();
        try (InputStream versionfile = PGPCardTool.class.getResourceAsStream("pgpcard.properties")) {
            if (versionfile == null) {
                return "unsupported";
            }
            prop.load(versionfile);
            return prop.getProperty("version", "unknown-development");
        } catch (IOException e) {
            return "unknown-error";
        }
    }

    public int run(String[] argv) {
        final OptionSet args;
        try {
            args = parseArguments(argv);
        } catch (OptionException | IllegalArgumentException e) {
            printHelp(err);
            err.println();
            if (e.getCause() != null) {
                err.println(e.getMessage() + ": " + e.getCause().getMessage());
            } else {
                err.println(e.getMessage());
            }
            return 1;
        }

        if (args.has(OPT_HELP) || args.specs().isEmpty()) {
            printHelp(out);
            return 0;
        }

        setupLogging(args);

        if (args.has(OPT_VERSION) || isVerbose) {
            out.printf("# pgpcard %s%n", getVersion());
            out.printf("# Running on %s %s %s", System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch"));
            out.printf(", Java %s by %s%n", System.getProperty("java.version"), System.getProperty("java.vendor"));
        }
        if (!args.has(OPT_FILE) && !args.has(OPT_DATA)) {
            if (args.has(OPT_VERSION)) {
                return 0;
            }
            err.println("Specify GET DATA responses with --file or --data");
            return 1;
        }

        try {
            var responses = new ArrayList<byte[]>();
            if (args.has(OPT_FILE)) {
                responses.addAll(DumpFile.read(args.valueOf(OPT_FILE).toPath()));
            }
            args.valuesOf(OPT_DATA).forEach(h -> responses.add(h.value()));
            verbose("Decoding %d responses".formatted(responses.size()));

            var tags = merge(responses, args.has(OPT_DUMP));
            if (!tags.has(OpenPGPTags.APPLICATION_RELATED_DATA) && args.has(OPT_DUMP)) {
                // Only a structure dump of something else
                return 0;
            }

            var reader = optional(args, OPT_READER).orElse(env.getOrDefault(ENV_PGPCARD_READER, DEFAULT_READER));
            var card = OpenPGPCard.fromTags(reader, tags);
            out.print(card.toPrettyString());
            if (isVerbose) {
                details(card);
            }

            if (args.has(OPT_KEYS)) {
                out.println();
                for (var keyType : KeyType.values()) {
                    out.println(KeySummary.line(card, keyType));
                }
            }

            if (args.has(OPT_CAPABILITIES)) {
                out.println();
                capabilities(card.capabilities());
            }
            return 0;
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            if (isTrace)
                e.printStackTrace(err);
        } catch (IllegalArgumentException e) {
            err.println("Invalid data: " + e.getMessage());
            if (isTrace)
                e.printStackTrace(err);
        } catch (OpenPGPException e) {
            err.println("Error: " + e.getMessage());
            if (isTrace)
                e.printStackTrace(err);
        }
        return 1;
    }

    private TagMap merge(List<byte[]> responses, boolean dump) {
        var tags = TagMap.empty();
        for (var response : responses) {
            if (dump) {
                for (var tlv : TLV.parse(response)) {
                    tlv.visualize().forEach(out::println);
                }
            }
            // First response wins for repeated paths
            tags = tags.merge(TagMap.parse(response));
        }
        return tags;
    }

    private void details(OpenPGPCard card) {
        card.language().ifPresent(l -> out.println("  Language:        " + l));
        if (card.tags().has(OpenPGPTags.SIGNATURE_COUNTER)) {
            out.println("  Signatures:      " + card.signatureCounter());
        }
        if (card.tags().has(OpenPGPTags.PW_STATUS_BYTES)) {
            var pw = card.passwordStatus();
            out.printf("  PIN retries:     %d %d %d%n", pw.pw1Retries(), pw.rcRetries(), pw.pw3Retries());
        }
    }

    private void capabilities(ExtendedCapabilities caps) {
        out.println("Extended capabilities:");
        out.println("  Flags:              " + (caps.flags().isEmpty() ? "none" : caps.flags().stream().map(Enum::name).collect(Collectors.joining(", "))));
        out.println("  Secure messaging:   " + caps.secureMessaging());
        out.println("  Max challenge:      " + caps.maximumChallengeLength());
        out.println("  Max certificate:    " + caps.maximumCardholderCertificatesLength());
        out.println("  Max special DO:     " + caps.maximumSpecialDOsLength());
        out.println("  PIN block 2 format: " + caps.pinBlock2Supported());
        out.println("  MSE:                " + caps.mseCommandSupported());
    }

    private void printHelp(PrintStream stream) {
        try {
            parser.printHelpOn(stream);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private void verbose(String s) {
        if (isVerbose) {
            out.println("# " + s);
        }
    }
}
