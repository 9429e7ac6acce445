package sbtext;

/** Notified synchronously after each discrete unit of code generation or packaging work. */
@FunctionalInterface
public interface ProgressListener {
  ProgressListener NONE = (step, total, label) -> {};

  void onProgress(int step, int total, String label);
}
