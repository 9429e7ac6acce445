package sbtext;

import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.collect.ImmutableSortedSet;

/** Collects every broadcast message that a script receives or a statement sends. */
class BroadcastCollector extends VoidDefaultASTVisitor {
  private final SortedSet<String> messages = new TreeSet<>();

  static ImmutableSortedSet<String> collect(Project project) {
    BroadcastCollector collector = new BroadcastCollector();
    project.accept(collector, null);
    return ImmutableSortedSet.copyOf(collector.messages);
  }

  @Override
  public void visitImpl(Project.EventScript script) {
    script.message().ifPresent(messages::add);
    script.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.Broadcast broadcast) {
    messages.add(broadcast.message());
  }
}
