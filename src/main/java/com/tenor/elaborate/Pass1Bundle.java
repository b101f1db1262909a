package com.tenor.elaborate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tenor.debug.Debug;
import com.tenor.elaborate.parser.Parser;
import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawConstruct.Construct;

/**
 * Pass 0 + 1: parses the root file and its transitive imports into one flat
 * construct list. Imported constructs precede the importing file's own.
 */
final class Pass1Bundle {

    private static final String TAG = "tenor.elab";

    /** Output of Pass 1: bundle id plus all non-import constructs. */
    static final class Loaded {
        final String bundleId;
        final List<Construct> constructs;

        Loaded(String bundleId, List<Construct> constructs) {
            this.bundleId = bundleId;
            this.constructs = List.copyOf(constructs);
        }
    }

    private final SourceProvider provider;
    private final ElaborationOptions options;
    private final Set<Path> visited = new HashSet<>();
    private final List<Path> stack = new ArrayList<>();
    private final List<Construct> out = new ArrayList<>();
    private final Map<Construct, Path> origin = new IdentityHashMap<>();
    private Path sandboxRoot;

    Pass1Bundle(SourceProvider provider, ElaborationOptions options) {
        this.provider = provider;
        this.options = options;
    }

    Loaded load(Path root) {
        Path canon;
        try {
            canon = provider.canonicalize(root);
        } catch (IOException e) {
            throw new ElaborationException(new ElabError(1, null, null, null, root.toString(), 0,
                    "cannot open file: " + describe(e)));
        }
        sandboxRoot = canon.getParent();
        String fileName = canon.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String bundleId = dot > 0 ? fileName.substring(0, dot) : fileName;

        loadFile(canon);
        checkCrossFileDuplicates();
        Debug.get().d(TAG, "pass 1: loaded " + visited.size() + " file(s), " + out.size() + " construct(s)");
        return new Loaded(bundleId, out);
    }

    private void loadFile(Path canon) {
        if (visited.contains(canon)) return;
        if (visited.size() >= options.maxImportFiles()) {
            throw new ElaborationException(new ElabError(1, null, null, "import", display(canon), 0,
                    "import graph exceeds the limit of " + options.maxImportFiles() + " files"));
        }
        if (stack.size() >= options.maxImportDepth()) {
            throw new ElaborationException(new ElabError(1, null, null, "import", display(canon), 0,
                    "import depth exceeds the limit of " + options.maxImportDepth()));
        }

        String fileName = display(canon);
        String source;
        try {
            source = provider.read(canon);
        } catch (IOException e) {
            throw new ElaborationException(new ElabError(1, null, null, null, fileName, 0,
                    "cannot open file: " + describe(e)));
        }
        List<Construct> parsed = Parser.parse(source, fileName);

        visited.add(canon);
        stack.add(canon);
        List<Construct> local = new ArrayList<>();
        for (Construct c : parsed) {
            if (c instanceof RawConstruct.Import) {
                loadImport((RawConstruct.Import) c, canon.getParent());
            } else {
                local.add(c);
                origin.put(c, canon);
            }
        }
        stack.remove(stack.size() - 1);
        out.addAll(local);
    }

    private void loadImport(RawConstruct.Import imp, Path baseDir) {
        Path target;
        try {
            target = provider.canonicalize(baseDir.resolve(imp.path));
        } catch (IOException e) {
            throw new ElaborationException(new ElabError(1, null, null, "import", imp.file, imp.line,
                    "import resolution failed: cannot resolve path '" + imp.path + "'"));
        }
        if (sandboxRoot != null && !target.startsWith(sandboxRoot)) {
            throw new ElaborationException(new ElabError(1, null, null, "import", imp.file, imp.line,
                    "import '" + imp.path + "' escapes the contract root directory"));
        }
        int open = stack.indexOf(target);
        if (open >= 0) {
            List<String> cycle = new ArrayList<>();
            for (int i = open; i < stack.size(); i++) cycle.add(display(stack.get(i)));
            cycle.add(display(target));
            throw new ElaborationException(new ElabError(1, null, null, "import", imp.file, imp.line,
                    "import cycle detected: " + String.join(" → ", cycle)));
        }
        loadFile(target);
    }

    private void checkCrossFileDuplicates() {
        Map<String, Construct> seen = new HashMap<>();
        for (Construct c : out) {
            String key = c.kind() + "\u0000" + c.id;
            Construct first = seen.putIfAbsent(key, c);
            if (first != null && !origin.get(first).equals(origin.get(c))) {
                throw new ElaborationException(new ElabError(1, c.kind(), c.id, "id", c.file, c.line,
                        "duplicate " + c.kind() + " id '" + c.id + "': first declared in " + first.file));
            }
        }
    }

    /** Path of a loaded file relative to the root file's directory, with '/' separators. */
    private String display(Path canon) {
        Path rel = sandboxRoot == null ? canon.getFileName() : sandboxRoot.relativize(canon);
        return rel.toString().replace('\\', '/');
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
