package com.codeheadsystems.keystone.error;

import com.codeheadsystems.keystone.model.error.ErrorObject;
import com.codeheadsystems.keystone.model.error.ErrorSource;
import com.codeheadsystems.keystone.model.error.ErrorsResponse;
import java.util.List;

/**
 * A client error that is not about who the caller is: invalid input, a missing entity or a
 * conflicting write.
 */
public class RequestException extends ApiException {

  private final ErrorObject error;

  public RequestException(final ErrorObject error) {
    super(error.status() + ": " + error.detail());
    this.error = error;
  }

  /**
   * A 400 pointing at one field of the request body.
   *
   * @param detail  the detail
   * @param pointer JSON pointer of the offending field
   * @return the exception
   */
  public static RequestException badRequest(String detail, String pointer) {
    return new RequestException(ErrorObject.of(400, detail).withSource(ErrorSource.pointer(pointer)));
  }

  /**
   * A 400 pointing at a query or path parameter.
   *
   * @param detail    the detail
   * @param parameter the parameter name
   * @return the exception
   */
  public static RequestException badParameter(String detail, String parameter) {
    return new RequestException(ErrorObject.of(400, detail).withSource(ErrorSource.parameter(parameter)));
  }

  public static RequestException notFound(String detail) {
    return new RequestException(ErrorObject.of(404, detail));
  }

  public static RequestException conflict(String detail) {
    return new RequestException(ErrorObject.of(409, detail));
  }

  public ErrorObject error() {
    return error;
  }

  @Override
  public int status() {
    return error.status();
  }

  @Override
  public ErrorReply toReply(ErrorRelay relay) {
    return relay.reply(error.status(), new ErrorsResponse(List.of(error)));
  }
}
