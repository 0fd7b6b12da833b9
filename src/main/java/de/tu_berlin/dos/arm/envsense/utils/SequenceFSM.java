package de.tu_berlin.dos.arm.envsense.utils;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * A linear state machine over an enum: the first constant is the entry state, the last constant is the
 * terminal state. Each stage performs its work and names the next stage.
 */
public interface SequenceFSM<C, E extends Enum<E> & SequenceFSM<C, E>> {

    Logger LOG = Logger.getLogger(SequenceFSM.class);

    E runStage(C context) throws Exception;

    /**
     * Runs the stages from the entry state until the terminal state is reached and returns every state
     * visited, entry and terminal state included.
     */
    default List<E> run(Class<E> definition, C context) throws Exception {

        E[] stages = definition.getEnumConstants();
        E finalState = stages[stages.length - 1];
        E curState = stages[0];

        List<E> path = new ArrayList<>();
        path.add(curState);
        while (curState != finalState) {

            E prev = curState;
            curState = curState.runStage(context);
            if (curState == null) throw new IllegalStateException("Stage " + prev + " returned no successor");
            path.add(curState);
            LOG.info("STATE-CHANGE: " + prev + " -> " + curState);
        }
        return path;
    }
}
