package com.zzf.optrace.trace.writer;

/**
 * The engine's own pretty-printer for plans and expressions.
 *
 * @param <P> plan or expression type understood by the printer
 */
@FunctionalInterface
public interface PlanPrinter<P> {
    String print(P plan) throws Exception;
}
