package com.gentoro.specops.merge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.DependencyType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DependencyMergerTest {

  @Test
  @DisplayName("A versioned record replaces an unversioned one in place")
  void versionWins() {
    List<Dependency> out =
        DependencyMerger.deduplicate(
            List.of(
                Dependency.runtime("requests", null, "doc"),
                Dependency.runtime("flask", "==3.0", "doc"),
                new Dependency("Requests", ">=2.0", DependencyType.RUNTIME, "manifest"),
                Dependency.runtime("flask", "==2.0", "manifest")));

    assertEquals(2, out.size());
    assertEquals("Requests", out.get(0).name());
    assertEquals(">=2.0", out.get(0).version());
    assertEquals("==3.0", out.get(1).version(), "first versioned record is kept");
  }
}
