package im.arun.docingest.model;

import lombok.Value;

@Value
public class UnitFailure {
    String unitName;
    ErrorKind errorKind;
    String message;
}
