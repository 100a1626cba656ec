package com.asiainfo.errortracking.domain.ast;

import java.util.List;

/**
 * 列或属性引用，chain 为点分路径，如 ["properties", "$browser"]
 */
public record Field(List<String> chain) implements TableExpr {

    public Field {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Field chain must not be empty");
        }
        chain = List.copyOf(chain);
    }

    public String last() {
        return chain.get(chain.size() - 1);
    }
}
