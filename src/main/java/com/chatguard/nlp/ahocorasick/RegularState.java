package com.chatguard.nlp.ahocorasick;

import java.util.Arrays;

/**
 * A non-root state. Most states have one or two children, so the transition
 * map is inlined instead of backed by a {@code HashMap}.
 */
class RegularState extends State {
  private static final char[] EMPTY_CHARS = new char[0];

  // if the map has size 0, keys is null, states is null
  // if the map has size 1, keys is a Character, states is an Integer
  // else keys is char[] and states is an int[] of the same size
  // carrying the chars in parallel
  private Object keys = null;
  private Object states = null;

  @Override
  int get(char key) {
    if (this.keys == null) return NO_STATE;

    if (this.keys instanceof Character) {
      if (((Character) this.keys).charValue() == key) {
        return ((Integer) this.states).intValue();
      } else {
        return NO_STATE;
      }
    }

    char[] keys = (char[]) this.keys;
    for (int i = 0; i < keys.length; ++i) {
      if (keys[i] == key) {
        return ((int[]) this.states)[i];
      }
    }
    return NO_STATE;
  }

  @Override
  char[] keys() {
    if (this.keys == null) {
      return EMPTY_CHARS;
    } else if (this.keys instanceof Character) {
      return new char[] { ((Character) this.keys).charValue() };
    } else {
      return (char[]) this.keys;
    }
  }

  @Override
  void put(char key, int stateIndex) {
    if (this.keys == null) {
      this.keys = key;
      this.states = stateIndex;
      return;
    }

    if (this.keys instanceof Character) {
      if (((Character) this.keys).charValue() == key) {
        this.states = stateIndex;
      } else {
        this.keys = new char[] { ((Character) this.keys).charValue(), key };
        this.states = new int[] { ((Integer) this.states).intValue(), stateIndex };
      }
      return;
    }

    char[] keys = (char[]) this.keys;
    int[] states = (int[]) this.states;

    for (int i = 0; i < keys.length; ++i) {
      if (keys[i] == key) {
        states[i] = stateIndex;
        return;
      }
    }

    char[] newkeys = Arrays.copyOf(keys, keys.length + 1);
    newkeys[newkeys.length - 1] = key;

    int[] newstates = Arrays.copyOf(states, states.length + 1);
    newstates[newstates.length - 1] = stateIndex;

    this.keys = newkeys;
    this.states = newstates;
  }
}
