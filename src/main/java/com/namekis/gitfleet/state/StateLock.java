package com.namekis.gitfleet.state;

/** Machine wide exclusive lock held for one load-modify-persist cycle. Released by {@link #close()}. */
public interface StateLock extends AutoCloseable {
  @Override
  void close();
}
