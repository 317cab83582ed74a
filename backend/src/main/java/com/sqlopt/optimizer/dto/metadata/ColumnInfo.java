package com.sqlopt.optimizer.dto.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class ColumnInfo {

  @JsonProperty("name")
  String name;

  @JsonProperty("type")
  String type;
}
