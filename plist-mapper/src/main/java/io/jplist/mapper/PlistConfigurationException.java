package io.jplist.mapper;

import io.jplist.api.ErrorKind;
import io.jplist.api.PlistException;
import java.lang.reflect.Type;

/**
 * Exception thrown when a host type cannot be mapped at all, such as an interface with no known
 * implementation, a map with non-string keys or a class without a no-argument constructor. It is
 * raised while the mapping for the type is built, before any event is read or written.
 */
public class PlistConfigurationException extends PlistException {

  public PlistConfigurationException(String message, String context) {
    super(ErrorKind.UNSUPPORTED_VALUE, message, context);
  }

  public PlistConfigurationException(String message, String context, Throwable cause) {
    super(ErrorKind.UNSUPPORTED_VALUE, message, context, cause);
  }

  public static PlistConfigurationException unsupportedType(Type type, String reason) {
    return new PlistConfigurationException("Cannot map type: " + reason, type.getTypeName());
  }

  public static PlistConfigurationException noDefaultConstructor(Class<?> type) {
    return new PlistConfigurationException(
        "Class needs a no-argument constructor or must be a record", type.getName());
  }

  public static PlistConfigurationException duplicateKey(Class<?> type, String key) {
    return new PlistConfigurationException(
        String.format("Key '%s' is mapped by more than one field", key), type.getName());
  }

  public static PlistConfigurationException inaccessible(Class<?> type, Throwable cause) {
    return new PlistConfigurationException("Cannot access members", type.getName(), cause);
  }
}
