package com.chatguard.nlp.ahocorasick;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator over the matches of one scan. Each call to
 * {@link AhoCorasick#iterator(String)} gets its own Searcher, so the automaton
 * itself carries no scan state.
 */
class Searcher<T> implements Iterator<SearchResult<T>> {

  private final AhoCorasick<T> automaton;
  private final String text;

  private int currIndex;      // Index of the next char to consume.
  private int currState;
  private int[] pending;      // Outputs of the state reached at currIndex - 1.
  private int pendingPos;

  Searcher(AhoCorasick<T> automaton, String text) {
    this.automaton = automaton;
    this.text = (text == null) ? "" : text;
    this.currIndex = 0;
    this.currState = AhoCorasick.ROOT;
    this.pending = null;
    this.pendingPos = 0;
    continueSearch();
  }

  /**
   * Advances the scan until a state with outputs is reached or the text is
   * exhausted.
   */
  private void continueSearch() {
    this.pending = null;
    this.pendingPos = 0;
    while (this.currIndex < this.text.length()) {
      char c = this.automaton.fold(this.text.charAt(this.currIndex++));
      this.currState = this.automaton.next(this.currState, c);

      // Continue lookup if no keyword ends at current index.
      State state = this.automaton.state(this.currState);
      if (!state.hasOutputs()) continue;

      this.pending = state.getOutputs();
      return;
    }
  }

  @Override
  public boolean hasNext() {
    return (this.pending != null);
  }

  @Override
  public SearchResult<T> next() {
    if (!hasNext()) throw new NoSuchElementException();
    Mention<T> mention = this.automaton.mention(this.pending[this.pendingPos++]);
    SearchResult<T> result = new SearchResult<>(mention, this.currIndex - 1);
    if (this.pendingPos >= this.pending.length) continueSearch();
    return result;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }
}
