package com.chatguard.nlp.ahocorasick;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
   <p>A finalized implementation of the Aho-Corasick string searching
   automaton. Instances come out of {@link AhoCorasickBuilder#build()}
   with every fail link and output set already computed, and are never
   modified afterwards, so one instance can be searched from many threads
   at once.</p>

   <p>
   Example usage:
   <code><pre>
       AhoCorasick&lt;String&gt; tree = new AhoCorasickBuilder&lt;String&gt;()
           .add("hello", "greeting")
           .add("world", "noun")
           .build();

       for (SearchResult&lt;String&gt; result : tree.search("hello world")) {
           System.out.println(result.getKeyword() + " at " + result.getPosition());
       }
   </pre></code>
   </p>
 */
public final class AhoCorasick<T> {
  static final int ROOT = 0;

  /**
   * Returns an automaton without keywords. Every search on it yields nothing.
   */
  public static <T> AhoCorasick<T> empty(boolean caseSensitive) {
    return new AhoCorasickBuilder<T>(caseSensitive).build();
  }

  private final ImmutableList<State> states;
  private final ImmutableList<Mention<T>> mentions;
  private final boolean caseSensitive;

  AhoCorasick(List<State> states, List<Mention<T>> mentions,
              boolean caseSensitive) {
    this.states = ImmutableList.copyOf(states);
    this.mentions = ImmutableList.copyOf(mentions);
    this.caseSensitive = caseSensitive;
  }

  public int getKeywordCount() {
    return this.mentions.size();
  }

  public int getRootChildCount() {
    return ((RootState) this.states.get(ROOT)).size();
  }

  public int getStateCount() {
    return this.states.size();
  }

  /**
   * Returns true if the (case-folded, unless case-sensitive) input is a prefix
   * of one of the keywords in the tree.
   */
  public boolean hasPrefix(String prefix) {
    if (prefix == null) return false;
    int state = ROOT;
    for (int i = 0; i < prefix.length(); ++i) {
      state = this.states.get(state).get(fold(prefix.charAt(i)));
      if (state == State.NO_STATE) return false;
    }
    return true;
  }

  public boolean isCaseSensitive() {
    return this.caseSensitive;
  }

  public boolean isEmpty() {
    return this.mentions.isEmpty();
  }

  /**
   * Starts a new search, and returns an Iterator of SearchResults in the
   * order the scan reaches them.
   */
  public Iterator<SearchResult<T>> iterator(String text) {
    return new Searcher<>(this, text);
  }

  /**
   * Scans the text once and returns every keyword occurrence, including
   * overlapping ones. Null or empty text yields an empty list.
   */
  public List<SearchResult<T>> search(String text) {
    if (Strings.isNullOrEmpty(text) || isEmpty()) return ImmutableList.of();
    return ImmutableList.copyOf(iterator(text));
  }

  /**
   * Same scan as {@link #search(String)}, keeping only the first occurrence of
   * each distinct keyword text.
   */
  public List<SearchResult<T>> searchUnique(String text) {
    if (Strings.isNullOrEmpty(text) || isEmpty()) return ImmutableList.of();
    Map<String, SearchResult<T>> unique = new LinkedHashMap<>();
    for (Iterator<SearchResult<T>> iter = iterator(text); iter.hasNext();) {
      SearchResult<T> result = iter.next();
      unique.putIfAbsent(result.getKeyword(), result);
    }
    return ImmutableList.copyOf(unique.values());
  }

  @Override
  public String toString() {
    return String.format("AhoCorasick[keywords=%d, states=%d, rootChildren=%d]",
                         getKeywordCount(), getStateCount(), getRootChildCount());
  }

  char fold(char c) {
    return fold(c, this.caseSensitive);
  }

  static char fold(char c, boolean caseSensitive) {
    // Fold char by char so that offsets keep pointing into the original text.
    return caseSensitive ? c : Character.toLowerCase(c);
  }

  Mention<T> mention(int index) {
    return this.mentions.get(index);
  }

  /**
   * Follows fail links until a state defines a transition on {@code c}, and
   * takes it. Falls back to the root when nothing matches.
   */
  int next(int state, char c) {
    int next;
    while ((next = this.states.get(state).get(c)) == State.NO_STATE &&
           state != ROOT) {
      state = this.states.get(state).getFail();
    }
    return (next == State.NO_STATE) ? ROOT : next;
  }

  State state(int index) {
    return this.states.get(index);
  }
}
