package org.polyfront.astnode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The module an import refers to: a dotted path ({@code scala.math}) or a
 * file name ({@code "./util"}, {@code <stdio.h>}).
 */
public final class ModuleName {
    // Exactly one of path and fileName is set
    public final List<IdNode> path;
    public final IdNode fileName;

    private ModuleName(List<IdNode> path, IdNode fileName) {
        this.path = path;
        this.fileName = fileName;
    }

    public static ModuleName dotted(List<IdNode> path) {
        return new ModuleName(path, null);
    }

    public static ModuleName file(IdNode fileName) {
        return new ModuleName(null, fileName);
    }

    public boolean isFile() {
        return fileName != null;
    }

    @Override
    public String toString() {
        if (isFile()) {
            return "file " + fileName.name;
        }
        return path.stream().map(id -> id.name).collect(Collectors.joining("."));
    }
}
