package com.chatguard.utils;

public class ProcessUtil {
  private static final long MB = 1024 * 1024;

  /** Heap in use right now, in megabytes. */
  public static long getUsedHeapMb() {
    Runtime runtime = Runtime.getRuntime();
    return (runtime.totalMemory() - runtime.freeMemory()) / MB;
  }

  public static long getMaxHeapMb() {
    return Runtime.getRuntime().maxMemory() / MB;
  }

  public static String getHeapConsumption() {
    return String.format("heap %d/%d MB", getUsedHeapMb(), getMaxHeapMb());
  }

  private ProcessUtil() {
  }
}
