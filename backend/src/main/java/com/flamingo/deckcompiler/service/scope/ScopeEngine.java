package com.flamingo.deckcompiler.service.scope;

import com.flamingo.deckcompiler.exception.VariableScopeException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Block-scoped variables evaluated in document order.
 *
 * <p>The walker pushes a frame when it enters an element and pops it when it leaves. Only open
 * frames are held, innermost on top, so memory follows the nesting depth of the document. Frame ids
 * are assigned from a counter and are never reused.
 *
 * <ul>
 *   <li>{@code set} binds in the innermost frame; a second {@code set} of the same name in that
 *       frame fails. A {@code set} in a nested frame shadows outer bindings until the nested frame
 *       is popped.
 *   <li>{@code mod} overwrites the binding in the innermost frame that owns the name, in place, so
 *       the change outlives the frame it was made from.
 *   <li>{@code get} reads the innermost binding.
 * </ul>
 *
 * <p>One engine serves one traversal; it is not thread-safe and not reentrant. Errors report the
 * path of the innermost open frame.
 */
public final class ScopeEngine {

  private final Deque<ScopeFrame> open = new ArrayDeque<>();
  private int created;

  /** Opens a frame for an element without positional context. */
  public int push() {
    return push(null);
  }

  /**
   * Opens a frame for the element at {@code nodePath}.
   *
   * @return the id of the new frame
   */
  public int push(String nodePath) {
    ScopeFrame frame = new ScopeFrame(created++, nodePath);
    open.push(frame);
    return frame.id();
  }

  /**
   * Closes the innermost frame. Its bindings become invisible.
   *
   * @throws IllegalStateException if no frame is open
   */
  public void pop() {
    if (open.isEmpty()) {
      throw new IllegalStateException("No scope frame to pop");
    }
    open.pop();
  }

  /**
   * Binds {@code name} in the innermost frame.
   *
   * @throws VariableScopeException with {@code DUPLICATE_SET_IN_SCOPE} if that frame already owns
   *     the name
   */
  public void set(String name, String value) {
    ScopeFrame current = current();
    if (current.owns(name)) {
      throw VariableScopeException.duplicateSet(name, current.nodePath());
    }
    current.bind(name, value);
  }

  /**
   * Overwrites the nearest visible binding of {@code name} in the frame that owns it.
   *
   * @throws VariableScopeException with {@code UNDEFINED_VARIABLE} if no open frame owns the name
   */
  public void mod(String name, String value) {
    lookup(name).overwrite(value);
  }

  /**
   * Returns the value of the nearest visible binding of {@code name}.
   *
   * @throws VariableScopeException with {@code UNDEFINED_VARIABLE} if no open frame owns the name
   */
  public String get(String name) {
    return lookup(name).value();
  }

  /**
   * Returns {@code get(prependVar) + raw + get(appendVar)}; a null variable name omits its side.
   */
  public String resolveAffix(String prependVar, String appendVar, String raw) {
    StringBuilder sb = new StringBuilder();
    if (prependVar != null) {
      sb.append(get(prependVar));
    }
    sb.append(raw);
    if (appendVar != null) {
      sb.append(get(appendVar));
    }
    return sb.toString();
  }

  /** Number of open frames. */
  public int depth() {
    return open.size();
  }

  /** Number of frames created so far, open or closed. */
  public int framesCreated() {
    return created;
  }

  /** Id of the frame owning the visible binding of {@code name}, for diagnostics. */
  public int ownerOf(String name) {
    return lookup(name).ownerFrameId();
  }

  private Binding lookup(String name) {
    for (ScopeFrame frame : open) {
      if (frame.owns(name)) {
        return frame.binding(name).orElseThrow();
      }
    }
    throw VariableScopeException.undefined(name, open.isEmpty() ? null : current().nodePath());
  }

  private ScopeFrame current() {
    if (open.isEmpty()) {
      throw new IllegalStateException("No scope frame is open");
    }
    return open.peek();
  }
}
