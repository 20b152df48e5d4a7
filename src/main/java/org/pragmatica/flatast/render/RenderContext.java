package org.pragmatica.flatast.render;

import org.pragmatica.flatast.error.FlatAstException;
import org.pragmatica.flatast.error.TreeError;
import org.pragmatica.flatast.tree.Address;
import org.pragmatica.flatast.tree.FlatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Mutable state of a single render pass: the store being walked and the output sink.
 */
public final class RenderContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderContext.class);

    private final FlatStore store;
    private final RenderConfig config;
    private final Appendable out;

    // Last character written; output starts at a line start
    private char last;

    private RenderContext(FlatStore store, RenderConfig config, Appendable out) {
        this.store = store;
        this.config = config;
        this.out = out;
        this.last = '\n';
    }

    public static RenderContext create(FlatStore store, RenderConfig config, Appendable out) {
        return new RenderContext(store, config, out);
    }

    public FlatStore store() {
        return store;
    }

    public RenderConfig config() {
        return config;
    }

    // === Tree Access ===

    public long child(long parent, int index) {
        return Address.child(parent, index);
    }

    public boolean present(long parent, int index) {
        return store.present(Address.child(parent, index));
    }

    public long tag(long address) {
        return store.tag(address);
    }

    public void checkDepth(long address, int depth) {
        if (depth > config.maxDepth()) {
            throw new FlatAstException(new TreeError.TooDeeplyNested(address, config.maxDepth()));
        }
    }

    /**
     * Check that a grammar-mandated child is present. When it is not, fail under
     * {@link OmissionPolicy#STRICT} and return false under {@link OmissionPolicy#LENIENT}.
     */
    public boolean require(long parent, int index, String expected) {
        if (present(parent, index)) {
            return true;
        }
        missing(parent, index, expected);
        return false;
    }

    public void missing(long parent, int index, String expected) {
        if (config.omissionPolicy() == OmissionPolicy.STRICT) {
            throw new FlatAstException(new TreeError.MissingChild(parent, index, expected));
        }
        LOGGER.debug("Child {} ({}) of {} is absent, rendering nothing", index, expected, Address.format(parent));
    }

    // === Output ===

    public void emit(String text) {
        if (text.isEmpty()) {
            return;
        }
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        last = text.charAt(text.length() - 1);
    }

    public void newline() {
        emit("\n");
    }

    /**
     * Emit a single space unless the output is at a line start or already ends with one.
     */
    public void space() {
        if (last != ' ' && last != '\n') {
            emit(" ");
        }
    }
}
