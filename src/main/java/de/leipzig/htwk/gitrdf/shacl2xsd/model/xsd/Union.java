package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.util.List;

public final class Union implements SimpleTypeContent {

  private final List<String> memberTypes;

  public Union(List<String> memberTypes) {
    this.memberTypes = List.copyOf(memberTypes);
  }

  public List<String> getMemberTypes() {
    return memberTypes;
  }
}
