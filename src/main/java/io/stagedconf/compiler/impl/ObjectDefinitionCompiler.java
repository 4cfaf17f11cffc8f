package io.stagedconf.compiler.impl;

import io.stagedconf.compiler.ConfigCompiler;
import io.stagedconf.compiler.Expression;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.model.ConfigItem;
import io.stagedconf.object.model.DebugInfo;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.object.type.TypeRegistry;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles object definitions against the known types. Each evaluation produces fresh
 * {@link ConfigItem}s.
 */
@RequiredArgsConstructor
public final class ObjectDefinitionCompiler implements ConfigCompiler {
    private final TypeRegistry types;

    @Override
    public Expression compileText(final Path path,
                                  final String text,
                                  final String zone,
                                  final String packageName) throws ConfigObjectException {
        final List<ObjectDefinition> defs = new ObjectDefinitionParser(path, text).parse();
        final List<ResolvedDefinition> resolved = new ArrayList<>(defs.size());

        for (final ObjectDefinition def : defs) {
            final Optional<ObjectType> type = types.getByName(def.typeName());
            if (type.isEmpty()) {
                throw new ConfigObjectException(ErrorKind.COMPILE, "Type '" + def.typeName()
                        + "' does not exist in " + path + ":" + def.line());
            }
            if (def.name().isEmpty()) {
                throw new ConfigObjectException(ErrorKind.COMPILE, "Object name must not be empty in "
                        + path + ":" + def.line());
            }
            resolved.add(new ResolvedDefinition(type.get(), def));
        }

        return context -> {
            for (final ResolvedDefinition r : resolved) {
                context.addItem(new ConfigItem(
                        r.type(),
                        r.def().name(),
                        r.def().imports(),
                        r.def().attributes(),
                        packageName,
                        zone,
                        new DebugInfo(path, r.def().line()),
                        r.def().ignoreOnError()));
            }
        };
    }

    private record ResolvedDefinition(ObjectType type, ObjectDefinition def) {
    }
}
