package im.arun.pdf2md.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorRecord {

    @JsonProperty("kind")
    private ErrorKind kind;

    @JsonProperty("message")
    private String message;
}
