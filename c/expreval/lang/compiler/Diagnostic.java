// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - diagnostics.
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

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Lexical or syntax error report. The compiler supplies only a message
 * template key and its arguments; the text is looked up from the
 * {@code expreval/lang/compiler/messages} resource bundle when asked for.
 */
public final class Diagnostic {
    static final String BUNDLE = "expreval.lang.compiler.messages";

    // template keys
    static final String INVALID_TOKEN       = "invalidToken";
    static final String EXPECTED_EXPRESSION = "expectedExpression";
    static final String EXPECTED_TOKEN      = "expectedToken";
    static final String UNEXPECTED_TOKEN    = "unexpectedToken";
    static final String TOO_COMPLEX         = "expressionTooComplex";

    private final SourceSpan span;
    private final String key;
    private final Object[] args;

    public Diagnostic(SourceSpan span, String key, Object... args) {
        this.span = span;
        this.key = key;
        this.args = args == null ? new Object[0] : args.clone();
    }

    public SourceSpan getSpan() {
        return span;
    }

    public String getKey() {
        return key;
    }

    public Object[] getArguments() {
        return args.clone();
    }

    public String getMessage() {
        return getMessage(Locale.getDefault());
    }

    public String getMessage(Locale locale) {
        String template;
        try {
            template = ResourceBundle.getBundle(BUNDLE, locale).getString(key);
        } catch (MissingResourceException ex) {
            // unknown key, show what we have
            return key + Arrays.asList(args);
        }
        return new MessageFormat(template, locale).format(args);
    }

    public boolean equals(Object o) {
        if (!(o instanceof Diagnostic))
            return false;
        Diagnostic d = (Diagnostic) o;
        return span.equals(d.span) && key.equals(d.key) &&
               Arrays.equals(args, d.args);
    }

    public int hashCode() {
        return (span.hashCode() * 31 + key.hashCode()) * 31
                + Arrays.hashCode(args);
    }

    public String toString() {
        return span.getStart() + ": " + getMessage();
    }
}
