package de.tu_berlin.dos.arm.envsense.utils;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequenceFSMTest {

    enum Traffic implements SequenceFSM<List<String>, Traffic> {

        RED {
            public Traffic runStage(List<String> log) {

                log.add("red");
                return log.size() > 2 ? GREEN : YELLOW;
            }
        },
        YELLOW {
            public Traffic runStage(List<String> log) {

                log.add("yellow");
                return RED;
            }
        },
        GREEN {
            public Traffic runStage(List<String> log) {

                throw new IllegalStateException("terminal");
            }
        }
    }

    enum Broken implements SequenceFSM<Object, Broken> {

        FIRST {
            public Broken runStage(Object context) {

                return null;
            }
        },
        LAST {
            public Broken runStage(Object context) {

                return null;
            }
        }
    }

    @Test
    void runsUntilTerminalStateAndReturnsPath() throws Exception {

        List<String> log = new ArrayList<>();
        List<Traffic> path = Traffic.RED.run(Traffic.class, log);

        assertEquals(List.of(Traffic.RED, Traffic.YELLOW, Traffic.RED, Traffic.GREEN), path);
        assertEquals(List.of("red", "yellow", "red"), log);
    }

    @Test
    void missingSuccessorFails() {

        assertThrows(IllegalStateException.class, () -> Broken.FIRST.run(Broken.class, new Object()));
    }
}
