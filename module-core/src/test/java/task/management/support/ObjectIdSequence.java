package task.management.support;

import java.util.concurrent.atomic.AtomicLong;

/** 24자리 hex ID 생성기 (MongoDB ObjectId 형식 흉내) */
final class ObjectIdSequence {

  private final AtomicLong counter = new AtomicLong();

  String next() {
    return String.format("%024x", counter.incrementAndGet());
  }
}
