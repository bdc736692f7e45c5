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

import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.File;
import java.util.Arrays;
import java.util.Optional;

abstract class PGPCardCommandLineInterface {
    static OptionParser parser = new OptionParser();
    // Generic options
    protected static OptionSpec<Void> OPT_VERSION = parser.acceptsAll(Arrays.asList("V", "version"), "Show information about the program");
    protected static OptionSpec<Void> OPT_HELP = parser.acceptsAll(Arrays.asList("h", "?", "help"), "Shows this help").forHelp();
    protected static OptionSpec<Void> OPT_DEBUG = parser.acceptsAll(Arrays.asList("d", "debug"), "Show decoding trace");
    protected static OptionSpec<Void> OPT_VERBOSE = parser.acceptsAll(Arrays.asList("v", "verbose"), "Be verbose about operations");
    protected static OptionSpec<String> OPT_READER = parser.acceptsAll(Arrays.asList("r", "reader"), "Name of the reader the data was read from").withRequiredArg().describedAs("reader");

    // Input
    protected static OptionSpec<File> OPT_FILE = parser.accepts("file", "Read GET DATA responses from file, one hex line each").withRequiredArg().ofType(File.class).describedAs("path");
    protected static OptionSpec<HexBytes> OPT_DATA = parser.accepts("data", "GET DATA response").withRequiredArg().ofType(HexBytes.class).describedAs("hex");

    // Output
    protected static OptionSpec<Void> OPT_KEYS = parser.accepts("keys", "List key slots");
    protected static OptionSpec<Void> OPT_CAPABILITIES = parser.accepts("capabilities", "Show extended capabilities");
    protected static OptionSpec<Void> OPT_DUMP = parser.accepts("dump", "Show the TLV structure of the responses");

    protected static <V> Optional<V> optional(OptionSet args, OptionSpec<V> v) {
        return args.has(v) ? Optional.of(args.valueOf(v)) : Optional.empty();
    }

    protected static OptionSet parseArguments(String[] argv) {
        var args = parser.parse(argv);
        // Values are converted lazily, surface conversion errors as argument errors
        args.specs().forEach(args::valuesOf);
        if (!args.nonOptionArguments().isEmpty()) {
            throw new IllegalArgumentException("Invalid non-option arguments: " + String.join(" ", args.nonOptionArguments().stream().map(Object::toString).toList()));
        }
        return args;
    }
}
