package dev.dimitra.auditor.llm;

/** Creates providers by name; lets the orchestrator be driven by test doubles. */
@FunctionalInterface
public interface ProviderFactory {

    AuditProvider create(String provider, String model);
}
