package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TaskMeta {
    String subtitle;
    StorageTarget storage;
}
