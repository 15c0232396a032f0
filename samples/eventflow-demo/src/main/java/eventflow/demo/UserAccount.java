package eventflow.demo;

import eventflow.EventType;
import eventflow.aggregate.AggregateRoot;
import eventflow.aggregate.EventMutators;

/**
 * Account of a learner, tutor or administrator on the platform.
 */
public final class UserAccount extends AggregateRoot<UserAccount> {
  public static final String TYPE = "USER_ACCOUNT";

  public enum Role {
    STUDENT, TUTOR, ADMIN, SUPERADMIN
  }

  public enum Status {
    ACTIVE, INACTIVE, SUSPENDED, PENDING_VERIFICATION
  }

  public enum Events implements EventType {
    CREATED("user.created"),
    PROFILE_UPDATED("user.profile_updated"),
    ROLE_CHANGED("user.role_changed"),
    ACTIVATED("user.activated"),
    DEACTIVATED("user.deactivated");

    private final String eventName;

    Events(String eventName) {
      this.eventName = eventName;
    }

    @Override
    public String eventName() {
      return eventName;
    }
  }

  public record Created(String email, String name, Role role) {
  }

  public record ProfileUpdated(String name) {
  }

  public record RoleChanged(Role from, Role to) {
  }

  public record Activated() {
  }

  public record Deactivated(String reason) {
  }

  private static final EventMutators<UserAccount> MUTATORS = EventMutators.<UserAccount>builder()
      .on(Events.CREATED, Created.class, (u, p) -> u.onCreated(p))
      .on(Events.PROFILE_UPDATED, ProfileUpdated.class, (u, p) -> u.name = p.name())
      .on(Events.ROLE_CHANGED, RoleChanged.class, (u, p) -> u.role = p.to())
      .on(Events.ACTIVATED, Activated.class, (u, p) -> u.status = Status.ACTIVE)
      .on(Events.DEACTIVATED, Deactivated.class, (u, p) -> u.status = Status.INACTIVE)
      .build();

  private String email;
  private String name;
  private Role role;
  private Status status;

  public UserAccount(String id) {
    super(TYPE, id);
  }

  public void create(String email, String name, Role role) {
    if (status != null) {
      throw new IllegalStateException("User " + aggregateId() + " already exists");
    }
    if (email == null || !email.contains("@")) {
      throw new IllegalArgumentException("Invalid email: " + email);
    }
    raise(Events.CREATED, new Created(email, name, role));
  }

  public void updateProfile(String newName) {
    requireExisting();
    if (!newName.equals(name)) {
      raise(Events.PROFILE_UPDATED, new ProfileUpdated(newName));
    }
  }

  public void changeRole(Role newRole) {
    requireExisting();
    if (status == Status.INACTIVE || status == Status.SUSPENDED) {
      throw new IllegalStateException("Cannot change role of " + status + " user " + aggregateId());
    }
    if (newRole != role) {
      raise(Events.ROLE_CHANGED, new RoleChanged(role, newRole));
    }
  }

  public void activate() {
    requireExisting();
    if (status != Status.ACTIVE) {
      raise(Events.ACTIVATED, new Activated());
    }
  }

  public void deactivate(String reason) {
    requireExisting();
    if (status != Status.INACTIVE) {
      raise(Events.DEACTIVATED, new Deactivated(reason));
    }
  }

  public String email() {
    return email;
  }

  public String name() {
    return name;
  }

  public Role role() {
    return role;
  }

  public Status status() {
    return status;
  }

  @Override
  protected EventMutators<UserAccount> mutators() {
    return MUTATORS;
  }

  private void requireExisting() {
    if (status == null) {
      throw new IllegalStateException("User " + aggregateId() + " does not exist");
    }
  }

  private void onCreated(Created created) {
    email = created.email();
    name = created.name();
    role = created.role();
    status = Status.PENDING_VERIFICATION;
  }
}
