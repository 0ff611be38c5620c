package com.chatguard.nlp.ahocorasick;

import java.util.Arrays;

/**
 * A state represents an element in the Aho-Corasick tree. States live in an
 * arena owned by the automaton; transitions and the fail link are indices into
 * that arena, so a state never owns the state it fails to.
 */
abstract class State {
  static final int NO_STATE = -1;

  // Here's an inlined set of ints backed by an array of ints.
  private static final int[] EMPTY_INTS = new int[0];

  // null when empty
  // an Integer when size 1
  // an int[] when size > 1
  private Object outputs = null;
  private int fail = NO_STATE;

  void addOutput(int mentionIndex) {
    if (this.outputs == null) {
      this.outputs = mentionIndex;
    } else if (this.outputs instanceof Integer) {
      int v = ((Integer) this.outputs).intValue();
      if (mentionIndex != v) {
        this.outputs = new int[] {v, mentionIndex};
      }
    } else {
      int[] outputs = (int[]) this.outputs;
      for (int v : outputs) {
        if (v == mentionIndex) return;
      }
      int[] newoutputs = Arrays.copyOf(outputs, outputs.length + 1);
      newoutputs[newoutputs.length - 1] = mentionIndex;
      this.outputs = newoutputs;
    }
  }

  void addOutputs(int[] mentionIndices) {
    for (int i : mentionIndices) {
      this.addOutput(i);
    }
  }

  /**
   * Returns the arena index of the child reached on {@code key}, or
   * {@link #NO_STATE} if there is none.
   */
  abstract int get(char key);

  abstract char[] keys();

  abstract void put(char key, int stateIndex);

  int getFail() {
    return this.fail;
  }

  int[] getOutputs() {
    if (this.outputs == null) {
      return EMPTY_INTS;
    } else if (this.outputs instanceof Integer) {
      return new int[] { ((Integer) this.outputs).intValue() };
    } else {
      return (int[]) this.outputs;
    }
  }

  boolean hasOutputs() {
    return this.outputs != null;
  }

  void setFail(int fail) {
    this.fail = fail;
  }
}
