package sbtext;

/** True when any statement of the tree needs the pen extension. */
class PenUsageDetector extends DefaultASTVisitor<Boolean> {

  static boolean usesPen(Project project) {
    return project.accept(new PenUsageDetector(), false);
  }

  @Override
  public Boolean visit(Statement.Block block, Boolean value) {
    return value || block.opcode().usesPen();
  }
}
