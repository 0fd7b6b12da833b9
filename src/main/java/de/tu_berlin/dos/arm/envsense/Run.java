package de.tu_berlin.dos.arm.envsense;

import de.tu_berlin.dos.arm.envsense.core.Context;
import de.tu_berlin.dos.arm.envsense.core.QueryService;
import de.tu_berlin.dos.arm.envsense.core.SensorPipeline;
import org.apache.log4j.Logger;

public class Run {

    private static final Logger LOG = Logger.getLogger(Run.class);

    public static void main(String[] args) throws Exception {

        // get properties file and create collaborators
        Context context = Context.load();
        SensorPipeline pipeline = new SensorPipeline(context);
        QueryService queries = new QueryService(context);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {

            LOG.info("Shutting down, status " + queries.getStatus().toJson());
            pipeline.close();
            context.close();
        }));

        // first cycle runs immediately, the scheduler thread keeps the process alive afterwards
        pipeline.start();
    }
}
