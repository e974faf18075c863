package bugtrail.worker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

  @Test
  void publishesPercentageOfTotal() {
    List<ProgressTracker.Progress> published = new ArrayList<>();
    ProgressTracker tracker = new ProgressTracker(published::add, 3);

    tracker.update(1, "one");
    tracker.update(2, "two");
    tracker.complete(null);

    assertEquals(List.of(
        new ProgressTracker.Progress(1, 3, 33, "one"),
        new ProgressTracker.Progress(2, 3, 67, "two"),
        new ProgressTracker.Progress(3, 3, 100, "Complete")), published);
    assertEquals(3, tracker.currentStep());
  }

  @Test
  void percentageIsClamped() {
    List<ProgressTracker.Progress> published = new ArrayList<>();
    ProgressTracker tracker = new ProgressTracker(published::add, 2);

    tracker.update(5, "overshoot");

    assertEquals(100, published.get(0).percentage());
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ProgressTracker(p -> { }, 0));
    ProgressTracker tracker = new ProgressTracker(p -> { }, 2);
    assertThrows(IllegalArgumentException.class, () -> tracker.update(-1, "x"));
  }
}
