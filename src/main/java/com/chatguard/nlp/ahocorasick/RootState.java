package com.chatguard.nlp.ahocorasick;

import java.util.HashMap;
import java.util.Map;

import com.google.common.primitives.Chars;

/**
 * The root of the tree. It fans out to every first character of every
 * keyword, so its transitions are kept in a real map.
 */
class RootState extends State {
  private final Map<Character, Integer> charStateMap;

  RootState() {
    this.charStateMap = new HashMap<>();
  }

  @Override
  int get(char key) {
    Integer state = this.charStateMap.get(key);
    return (state == null) ? NO_STATE : state.intValue();
  }

  @Override
  char[] keys() {
    return Chars.toArray(this.charStateMap.keySet());
  }

  @Override
  void put(char key, int stateIndex) {
    this.charStateMap.put(key, stateIndex);
  }

  int size() {
    return this.charStateMap.size();
  }
}
