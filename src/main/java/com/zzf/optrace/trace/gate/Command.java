package com.zzf.optrace.trace.gate;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * What the host knows about a statement when it starts executing it.
 */
@Getter
@Builder
public class Command {
    private final CommandKind kind;
    private final byte[] text;
    @Builder.Default
    private final Charset charset = StandardCharsets.UTF_8;
    @Singular
    private final List<TableReference> tables;
    @Singular
    private final List<VariableAssignment> assignments;

    public static Command of(CommandKind kind, String sql, TableReference... tables) {
        return Command.builder()
                .kind(kind)
                .text(sql == null ? new byte[0] : sql.getBytes(StandardCharsets.UTF_8))
                .charset(StandardCharsets.UTF_8)
                .tables(Arrays.asList(tables))
                .build();
    }

    public static Command set(String sql, VariableAssignment... assignments) {
        return Command.builder()
                .kind(CommandKind.SET_OPTION)
                .text(sql == null ? new byte[0] : sql.getBytes(StandardCharsets.UTF_8))
                .charset(StandardCharsets.UTF_8)
                .assignments(Arrays.asList(assignments))
                .build();
    }

    public int getTextLength() {
        return text == null ? 0 : text.length;
    }
}
