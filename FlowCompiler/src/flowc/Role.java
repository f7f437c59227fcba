package flowc;

public enum Role {
  CONTAINER,
  DIALOGUE_LINE,
  BRANCH_CONDITION,
  HUB,
  INSTRUCTION,
  JUMP,
  CODE_BLOCK,
  ENTRY_POINT,
  IGNORED;
}
