package eventflow.spring;

import eventflow.EventType;
import eventflow.aggregate.AggregateRoot;
import eventflow.aggregate.EventMutators;

final class Enrollment extends AggregateRoot<Enrollment> {
  static final String TYPE = "ENROLLMENT";

  enum Events implements EventType {
    OPENED("enrollment.opened");

    private final String eventName;

    Events(String eventName) {
      this.eventName = eventName;
    }

    @Override
    public String eventName() {
      return eventName;
    }
  }

  record Opened(String studentId, String courseId) {
  }

  private static final EventMutators<Enrollment> MUTATORS = EventMutators.<Enrollment>builder()
      .on(Events.OPENED, Opened.class, (e, p) -> e.studentId = p.studentId())
      .build();

  private String studentId;

  Enrollment(String id) {
    super(TYPE, id);
  }

  void open(String studentId, String courseId) {
    if (this.studentId != null) {
      throw new IllegalStateException("Enrollment " + aggregateId() + " already open");
    }
    raise(Events.OPENED, new Opened(studentId, courseId));
  }

  String studentId() {
    return studentId;
  }

  @Override
  protected EventMutators<Enrollment> mutators() {
    return MUTATORS;
  }
}
