package com.chatguard.nlp.cache;

import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.utils.ProcessUtil;

/** Size and cost of the last matcher built by a {@link MatcherCache}. */
public final class BuildStats {
  private final int keywordCount;
  private final int stateCount;
  private final int rootChildCount;
  private final long buildMillis;
  private final long usedHeapMb;  // Sampled right after the build.

  static BuildStats of(AhoCorasick<?> automaton, long buildMillis) {
    return new BuildStats(automaton.getKeywordCount(), automaton.getStateCount(),
                          automaton.getRootChildCount(), buildMillis,
                          ProcessUtil.getUsedHeapMb());
  }

  BuildStats(int keywordCount, int stateCount, int rootChildCount,
             long buildMillis, long usedHeapMb) {
    this.keywordCount = keywordCount;
    this.stateCount = stateCount;
    this.rootChildCount = rootChildCount;
    this.buildMillis = buildMillis;
    this.usedHeapMb = usedHeapMb;
  }

  public long getBuildMillis() {
    return this.buildMillis;
  }

  public int getKeywordCount() {
    return this.keywordCount;
  }

  public int getRootChildCount() {
    return this.rootChildCount;
  }

  public int getStateCount() {
    return this.stateCount;
  }

  public long getUsedHeapMb() {
    return this.usedHeapMb;
  }

  @Override
  public String toString() {
    return String.format("%d keywords, %d states, %d root children in %d ms",
                         this.keywordCount, this.stateCount,
                         this.rootChildCount, this.buildMillis);
  }
}
