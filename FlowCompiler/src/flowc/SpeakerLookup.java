package flowc;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

@FunctionalInterface
public interface SpeakerLookup {
  String speakerName(FlowGraph.Node node);

  static SpeakerLookup none() {
    return node -> "";
  }

  static SpeakerLookup of(Map<String, String> characterIdsByEntity) {
    ImmutableMap<String, String> ids = ImmutableMap.copyOf(characterIdsByEntity);
    return node -> node.speakerId().map(ids::get).orElse("");
  }
}
