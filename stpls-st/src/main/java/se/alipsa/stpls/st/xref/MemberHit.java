package se.alipsa.stpls.st.xref;

import java.util.Optional;

/** What a position inside {@code instance.member} refers to. */
public final class MemberHit {
  private final MemberAccess access;
  private final InstanceBinding binding;
  private final FbMember member;

  MemberHit(MemberAccess access, InstanceBinding binding, FbMember member) {
    this.access = access;
    this.binding = binding;
    this.member = member;
  }

  public MemberAccess getAccess() { return access; }

  /** Present when the position is on the instance part and the instance is bound to a function block. */
  public Optional<InstanceBinding> getBinding() { return Optional.ofNullable(binding); }

  /** Present when the position is on the member part and the member resolves. */
  public Optional<FbMember> getMember() { return Optional.ofNullable(member); }

  public boolean isOnMember() {
    return member != null;
  }
}
