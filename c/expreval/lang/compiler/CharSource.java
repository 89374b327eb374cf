// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - character sources.
 *
 * Copyright (c) 2007-2013 Madis Janson
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package expreval.lang.compiler;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * Pull-based character input. Never rewinds.
 */
public interface CharSource {
    int EOF = -1;

    /** Next character, or {@link #EOF}, without consuming it. */
    int peek();

    /** Consumes and returns the next character, or {@link #EOF}. */
    int read();

    static CharSource of(CharSequence text) {
        return new StringSource(text);
    }

    static CharSource of(Reader reader) {
        return new ReaderSource(reader);
    }
}

final class StringSource implements CharSource {
    private final CharSequence src;
    private int p;

    StringSource(CharSequence src) {
        this.src = src;
    }

    public int peek() {
        return p < src.length() ? src.charAt(p) : EOF;
    }

    public int read() {
        return p < src.length() ? src.charAt(p++) : EOF;
    }
}

final class ReaderSource implements CharSource {
    private static final int NONE = -2;
    private final Reader reader;
    private int next = NONE;

    ReaderSource(Reader reader) {
        this.reader = reader;
    }

    public int peek() {
        if (next == NONE) {
            try {
                next = reader.read();
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }
        return next;
    }

    public int read() {
        int c = peek();
        if (c != EOF)
            next = NONE;
        return c;
    }
}
