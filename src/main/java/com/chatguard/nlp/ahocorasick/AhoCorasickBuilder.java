package com.chatguard.nlp.ahocorasick;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

import com.google.common.base.Strings;

/**
 * Collects keywords and turns them into an {@link AhoCorasick}. A builder
 * builds exactly once: after {@link #build()} it rejects further keywords and
 * further builds.
 */
public class AhoCorasickBuilder<T> {
  private final boolean caseSensitive;
  private final List<State> states;
  private final List<Mention<T>> mentions;
  private boolean isBuilt;

  public AhoCorasickBuilder() {
    this(false);
  }

  public AhoCorasickBuilder(boolean caseSensitive) {
    this.caseSensitive = caseSensitive;
    this.states = new ArrayList<>();
    this.states.add(new RootState());
    this.mentions = new ArrayList<>();
    this.isBuilt = false;
  }

  /**
   * Adds a new keyword with the given payload. During search, if the keyword
   * is matched, a SearchResult carrying the payload is yielded. Adding the same
   * keyword again adds a second output; nothing is overwritten.
   */
  public AhoCorasickBuilder<T> add(String keyword, T payload) {
    checkState(!this.isBuilt, "Can't add keywords after build() is called.");
    if (Strings.isNullOrEmpty(keyword)) return this;

    int lastState = extendAll(keyword);
    this.mentions.add(new Mention<>(keyword, payload));
    this.states.get(lastState).addOutput(this.mentions.size() - 1);
    return this;
  }

  /**
   * Computes fail links and merges output sets, then hands the states over to
   * an immutable automaton.
   *
   * Very order dependent: states are visited breadth first, so the fail state
   * of a child is always finalized before the child is.
   */
  public AhoCorasick<T> build() {
    checkState(!this.isBuilt, "build() has already been called.");
    this.isBuilt = true;

    Queue<Integer> queue = new ArrayDeque<>();
    State root = this.states.get(AhoCorasick.ROOT);
    for (char c : root.keys()) {
      int child = root.get(c);
      this.states.get(child).setFail(AhoCorasick.ROOT);
      queue.add(child);
    }

    while (!queue.isEmpty()) {
      State currState = this.states.get(queue.remove());

      for (char c : currState.keys()) {
        int failIndex = currState.getFail();
        int nextStateFail;

        // This is probably where most time is consumed in this method.
        while ((nextStateFail = this.states.get(failIndex).get(c)) == State.NO_STATE &&
               failIndex != AhoCorasick.ROOT) {
          failIndex = this.states.get(failIndex).getFail();
        }
        if (nextStateFail == State.NO_STATE) nextStateFail = AhoCorasick.ROOT;

        int next = currState.get(c);
        State nextState = this.states.get(next);
        nextState.setFail(nextStateFail);
        nextState.addOutputs(this.states.get(nextStateFail).getOutputs());
        queue.add(next);
      }
    }
    return new AhoCorasick<>(this.states, this.mentions, this.caseSensitive);
  }

  public boolean isCaseSensitive() {
    return this.caseSensitive;
  }

  /**
   * Returns the number of keywords added so far.
   */
  public int size() {
    return this.mentions.size();
  }

  private int extend(int state, char c) {
    int next = this.states.get(state).get(c);
    if (next != State.NO_STATE) return next;
    this.states.add(new RegularState());
    next = this.states.size() - 1;
    this.states.get(state).put(c, next);
    return next;
  }

  private int extendAll(String keyword) {
    int state = AhoCorasick.ROOT;  // Start extending from the root.
    for (int i = 0; i < keyword.length(); ++i) {
      state = extend(state, AhoCorasick.fold(keyword.charAt(i), this.caseSensitive));
    }
    return state;
  }
}
