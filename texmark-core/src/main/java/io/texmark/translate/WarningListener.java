package io.texmark.translate;

/** Side channel for warnings; called as each warning is raised. Never aborts translation. */
@FunctionalInterface
public interface WarningListener {

  WarningListener NONE = w -> {};

  void onWarning(Warning warning);
}
