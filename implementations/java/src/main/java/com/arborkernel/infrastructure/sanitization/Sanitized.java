package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.domain.model.Taint;
import lombok.Value;

/**
 * Successful sanitizer outcome.
 */
@Value
public class Sanitized {
    String value;
    Taint taint;
}
