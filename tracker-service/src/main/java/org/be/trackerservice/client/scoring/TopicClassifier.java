package org.be.trackerservice.client.scoring;

public interface TopicClassifier {

    String classify(String text);
}
