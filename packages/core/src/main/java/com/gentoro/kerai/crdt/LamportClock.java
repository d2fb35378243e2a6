package com.gentoro.kerai.crdt;

/** Logical clock: ticks for local events, jumps forward on observing remote time. */
public final class LamportClock {
  private long time;

  public LamportClock(long initial) {
    this.time = Math.max(0, initial);
  }

  public synchronized long tick() {
    return ++time;
  }

  public synchronized void observe(long remote) {
    if (remote > time) time = remote;
  }

  public synchronized long current() {
    return time;
  }
}
