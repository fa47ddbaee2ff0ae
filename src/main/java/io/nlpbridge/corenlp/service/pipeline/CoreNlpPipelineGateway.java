package io.nlpbridge.corenlp.service.pipeline;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Properties;

@Component
public class CoreNlpPipelineGateway implements PipelineGateway {

    private static final Logger logger = LoggerFactory.getLogger(CoreNlpPipelineGateway.class);

    @Override
    public StanfordCoreNLP createPipeline(Properties properties) {
        long startTime = System.currentTimeMillis();

        StanfordCoreNLP pipeline = new StanfordCoreNLP(properties);

        logger.info("Stanford CoreNLP pipeline [{}] constructed in {}ms",
                properties.getProperty("annotators"), System.currentTimeMillis() - startTime);
        return pipeline;
    }
}
