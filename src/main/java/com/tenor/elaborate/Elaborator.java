package com.tenor.elaborate;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.debug.Debug;
import com.tenor.elaborate.parser.RawConstruct.Construct;
import com.tenor.elaborate.parser.RawType;

/**
 * Entry point of the elaboration pipeline.
 *
 * <pre>
 *   ObjectNode bundle = new Elaborator().elaborate(Path.of("contract.tenor"));
 * </pre>
 *
 * Passes run strictly in order and the first failing pass aborts with an
 * {@link ElaborationException}; no partial bundle is ever returned.
 */
public final class Elaborator {

    private static final String TAG = "tenor.elab";

    private final ElaborationOptions options;

    public Elaborator() {
        this(ElaborationOptions.defaults());
    }

    public Elaborator(ElaborationOptions options) {
        this.options = options;
    }

    public ObjectNode elaborate(Path root) {
        return elaborate(root, new FileSystemSourceProvider());
    }

    public ObjectNode elaborate(Path root, SourceProvider provider) {
        try {
            Pass1Bundle.Loaded loaded = new Pass1Bundle(provider, options).load(root);
            ConstructIndex index = ConstructIndex.build(loaded.constructs);
            Map<String, RawType> types = Pass3Types.resolve(index);
            List<Construct> typed = Pass4TypeCheck.check(index, types);
            ConstructIndex resolved = ConstructIndex.rebuild(typed);
            Pass5Validate.validate(resolved);
            ObjectNode bundle = BundleSerializer.serialize(loaded.bundleId, typed);
            Debug.get().i(TAG, "elaborated bundle '" + loaded.bundleId + "' (" + typed.size() + " constructs)");
            return bundle;
        } catch (ElaborationException e) {
            Debug.get().w(TAG, "elaboration failed: " + e.error());
            throw e;
        }
    }
}
