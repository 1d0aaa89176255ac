package com.cronium.sandbox;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-language helper stubs shipped under {@code runtime/} on the classpath.
 * <p>
 * Each stub gives scripts {@code input()}, {@code output()}, {@code event()},
 * {@code setCondition()}, {@code getCondition()}, {@code getVariable()} and
 * {@code setVariable()} on top of the handoff files in the working directory.
 */
@Slf4j
public final class RuntimeHelpers {

    private static final Map<ScriptType, String> CACHE = new EnumMap<>(ScriptType.class);

    private RuntimeHelpers() {
    }

    /**
     * Source text of the helper for {@code type}.
     */
    public static synchronized String helperSource(ScriptType type) throws SandboxException {
        if (!type.isScript()) {
            throw new SandboxException("No runtime helper for " + type);
        }
        String cached = CACHE.get(type);
        if (cached != null)
            return cached;
        String resource = "runtime/" + type.helperFile();
        try (InputStream in = RuntimeHelpers.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new SandboxException("Runtime helper not found on classpath: " + resource);
            }
            String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            CACHE.put(type, source);
            return source;
        } catch (IOException e) {
            if (e instanceof SandboxException se)
                throw se;
            throw new SandboxException("Failed to read runtime helper " + resource, e);
        }
    }

    /**
     * Prefix that loads the helper from the script's working directory.
     */
    public static String loaderLine(ScriptType type) {
        return switch (type) {
            case BASH -> "#!/bin/bash\nsource ./cronium.sh\n\n";
            case PYTHON -> "import sys\nsys.path.insert(0, '.')\nfrom cronium import cronium\n\n";
            case NODEJS -> "const cronium = require('./cronium.js');\n\n";
            case HTTP_REQUEST -> "";
        };
    }

    public static String wrapScript(ScriptType type, String content) {
        return loaderLine(type) + (content != null ? content : "");
    }

    /**
     * Copy the helper into {@code dir} and write the wrapped script next to it.
     *
     * @return path of the script file
     */
    public static Path install(Path dir, ScriptType type, String content) throws IOException {
        Path helper = dir.resolve(type.helperFile());
        Files.writeString(helper, helperSource(type));
        Path script = dir.resolve("script" + type.extension());
        Files.writeString(script, wrapScript(type, content));
        if (type == ScriptType.BASH) {
            makeExecutable(helper);
            makeExecutable(script);
        }
        return script;
    }

    private static void makeExecutable(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not mark {} executable: {}", file, e.getMessage());
        }
    }
}
